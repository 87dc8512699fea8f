package com.yourname.codeoptimizer.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourname.codeoptimizer.model.Suggestion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns whatever the model returned under {@code suggestions} into a list of
 * {@link Suggestion}s. Every entry is kept, in order; its position supplies the
 * fallback id.
 */
@Component
public class SuggestionNormalizer {

    static final int MAX_TITLE_CODE_POINTS = 40;
    static final String DEFAULT_TITLE = "Suggestion";

    public List<Suggestion> normalize(JsonNode raw) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            return List.of();
        }
        if (!raw.isArray()) {
            return List.of(normalize(raw, 0));
        }

        List<Suggestion> normalized = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            normalized.add(normalize(raw.get(i), i));
        }
        return normalized;
    }

    private Suggestion normalize(JsonNode element, int index) {
        String fallbackId = "S" + (index + 1);

        return switch (element.getNodeType()) {
            case STRING -> {
                String text = element.textValue();
                yield new Suggestion(fallbackId, leading(text, MAX_TITLE_CODE_POINTS), text);
            }
            case OBJECT -> new Suggestion(
                firstText(fallbackId, element.get("id")),
                firstText(DEFAULT_TITLE, element.get("title"), element.get("description")),
                firstText("", element.get("detail"), element.get("description"))
            );
            case ARRAY, BINARY, BOOLEAN, MISSING, NULL, NUMBER, POJO ->
                new Suggestion(fallbackId, DEFAULT_TITLE, element.toString());
        };
    }

    private static String firstText(String fallback, JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate == null || candidate.isNull() || candidate.isMissingNode()) continue;
            return candidate.isValueNode() ? candidate.asText() : candidate.toString();
        }
        return fallback;
    }

    private static String leading(String text, int codePoints) {
        if (text.codePointCount(0, text.length()) <= codePoints) return text;
        return text.substring(0, text.offsetByCodePoints(0, codePoints));
    }
}
