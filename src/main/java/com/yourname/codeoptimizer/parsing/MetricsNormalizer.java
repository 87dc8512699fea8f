package com.yourname.codeoptimizer.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourname.codeoptimizer.model.Metrics;
import org.springframework.stereotype.Component;

/**
 * Maps the loosely named metrics a model reports onto {@link Metrics}.
 * Keys are looked up under their descriptive name first and their
 * canonical name second; anything missing or unusable falls back to a
 * default derived from the submitted code.
 */
@Component
public class MetricsNormalizer {

    public Metrics normalize(JsonNode raw, String language, String code) {
        JsonNode metrics = raw != null && raw.isObject() ? raw : null;
        int loc = countLines(code);

        return new Metrics(
            language,
            intValue(lookup(metrics, "Lines of Code Before", "loc_before"), loc),
            intValue(lookup(metrics, "Lines of Code After", "loc_after"), loc),
            intValue(lookup(metrics, "Lines of Code Reduced", "reduction"), 0),
            intValue(lookup(metrics, "Redundant Variables Removed", "redundant_removed"), null),
            boolValue(lookup(metrics, "String Input Security Improved", "security_improved"))
        );
    }

    /** Newline count plus one, so an empty snippet still counts as one line. */
    static int countLines(String code) {
        if (code == null) return 1;
        int lines = 1;
        for (int i = 0; i < code.length(); i++) {
            if (code.charAt(i) == '\n') lines++;
        }
        return lines;
    }

    // -------------------------------------------------------------------------

    private static JsonNode lookup(JsonNode metrics, String... keys) {
        if (metrics == null) return null;
        for (String key : keys) {
            JsonNode value = metrics.get(key);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    private static Integer intValue(JsonNode node, Integer fallback) {
        if (node == null) return fallback;
        if (node.isIntegralNumber() && node.canConvertToInt()) return node.intValue();
        if (node.isFloatingPointNumber()) {
            long rounded = Math.round(node.doubleValue());
            boolean fits = rounded >= Integer.MIN_VALUE && rounded <= Integer.MAX_VALUE;
            return fits && Double.isFinite(node.doubleValue()) ? (int) rounded : fallback;
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static boolean boolValue(JsonNode node) {
        if (node == null) return false;
        if (node.isBoolean()) return node.booleanValue();
        return node.isTextual() && "true".equalsIgnoreCase(node.textValue().trim());
    }
}
