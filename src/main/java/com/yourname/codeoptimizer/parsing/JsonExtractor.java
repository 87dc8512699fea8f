package com.yourname.codeoptimizer.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.codeoptimizer.exception.ExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Pulls the first JSON object out of a model completion. Models wrap their
 * answer in code fences or chatter despite being told not to, so the object
 * is located with a balanced-brace scan rather than parsing the whole text.
 */
@Component
public class JsonExtractor {

    private static final Logger log = LoggerFactory.getLogger(JsonExtractor.class);

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_FENCE = Pattern.compile("```$");

    private final ObjectMapper objectMapper;
    private final ObjectMapper lenientMapper;

    public JsonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientMapper = objectMapper.copy()
            .configure(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature(), true)
            .configure(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature(), true);
    }

    /**
     * Extracts and parses the first balanced JSON object in {@code text}.
     *
     * @throws ExtractionException if no object starts in the text, the object
     *                             never closes, or it does not parse
     */
    public JsonNode extract(String text) {
        String content = stripFences(text);

        int start = content.indexOf('{');
        if (start < 0) {
            log.warn("No JSON object in model output:\n{}", content);
            throw new ExtractionException("No JSON detected in model response");
        }

        int end = findClosingBrace(content, start);
        if (end < 0) {
            log.warn("Unterminated JSON object in model output:\n{}", content);
            throw new ExtractionException("Incomplete JSON block in model response");
        }

        return parse(content.substring(start, end + 1));
    }

    // -------------------------------------------------------------------------

    static String stripFences(String text) {
        String trimmed = text == null ? "" : text.trim();
        trimmed = LEADING_FENCE.matcher(trimmed).replaceFirst("").trim();
        return TRAILING_FENCE.matcher(trimmed).replaceFirst("").trim();
    }

    /**
     * Returns the index of the brace closing the object opened at {@code start},
     * or -1 if the text ends first. Braces inside string literals do not count;
     * single-quoted strings are tracked too since the lenient parse accepts them.
     */
    static int findClosingBrace(String text, int start) {
        int depth = 0;
        char quote = 0;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (quote != 0) {
                if (ch == '\\') {
                    escaped = true;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }

            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JsonNode parse(String candidate) {
        try {
            return objectMapper.readTree(candidate);
        } catch (JsonProcessingException strict) {
            try {
                return lenientMapper.readTree(candidate);
            } catch (JsonProcessingException e) {
                e.addSuppressed(strict);
                log.warn("Failed to parse JSON candidate:\n{}", candidate);
                throw new ExtractionException("Invalid JSON in model response: " + e.getOriginalMessage(), e);
            }
        }
    }
}
