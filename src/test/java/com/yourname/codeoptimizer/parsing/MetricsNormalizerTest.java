package com.yourname.codeoptimizer.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yourname.codeoptimizer.model.Metrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsNormalizerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MetricsNormalizer normalizer = new MetricsNormalizer();

    @Test
    void emptyMetricsFallBackToLineCount() throws Exception {
        Metrics metrics = normalizer.normalize(json("{}"), "c", "a\nb\nc");

        assertThat(metrics.language()).isEqualTo("c");
        assertThat(metrics.locBefore()).isEqualTo(3);
        assertThat(metrics.locAfter()).isEqualTo(3);
        assertThat(metrics.reduction()).isZero();
        assertThat(metrics.redundantRemoved()).isNull();
        assertThat(metrics.securityImproved()).isFalse();
    }

    @Test
    void descriptiveKeysAreMapped() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {
              "Lines of Code Before": 12,
              "Lines of Code After": 9,
              "Lines of Code Reduced": 3,
              "Redundant Variables Removed": 2,
              "String Input Security Improved": true
            }
            """), "c", "x");

        assertThat(metrics).isEqualTo(new Metrics("c", 12, 9, 3, 2, true));
    }

    @Test
    void canonicalKeysAreAcceptedAsAlternates() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {"loc_before": 10, "loc_after": 8, "reduction": 2, "security_improved": true}
            """), "java", "x");

        assertThat(metrics).isEqualTo(new Metrics("java", 10, 8, 2, null, true));
    }

    @Test
    void descriptiveKeyWinsOverCanonicalKey() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {"Lines of Code Before": 20, "loc_before": 10}
            """), "c", "x");

        assertThat(metrics.locBefore()).isEqualTo(20);
    }

    @Test
    void languageAlwaysComesFromTheRequest() throws Exception {
        Metrics metrics = normalizer.normalize(json("{\"language\": \"python\"}"), "c", "x");

        assertThat(metrics.language()).isEqualTo("c");
    }

    @Test
    void looselyTypedValuesAreCoerced() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {"loc_before": "15", "loc_after": 11.6, "reduction": "about four", "security_improved": "TRUE"}
            """), "c", "a\nb");

        assertThat(metrics.locBefore()).isEqualTo(15);
        assertThat(metrics.locAfter()).isEqualTo(12);
        assertThat(metrics.reduction()).isZero();
        assertThat(metrics.securityImproved()).isTrue();
    }

    @Test
    void outOfRangeNumbersFallBackToDefaults() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {"loc_before": 1e10, "loc_after": 1e400, "reduction": 3000000000, "redundant_removed": -1e12}
            """), "c", "a\nb");

        assertThat(metrics.locBefore()).isEqualTo(2);
        assertThat(metrics.locAfter()).isEqualTo(2);
        assertThat(metrics.reduction()).isZero();
        assertThat(metrics.redundantRemoved()).isNull();
    }

    @Test
    void nullValuesFallBackToDefaults() throws Exception {
        Metrics metrics = normalizer.normalize(json("""
            {"Lines of Code Before": null, "Redundant Variables Removed": null}
            """), "c", "a\nb");

        assertThat(metrics.locBefore()).isEqualTo(2);
        assertThat(metrics.redundantRemoved()).isNull();
    }

    @Test
    void nonObjectMetricsAreTreatedAsEmpty() throws Exception {
        Metrics fromArray = normalizer.normalize(json("[1, 2]"), "c", "one line");
        Metrics fromNull = normalizer.normalize(null, "c", "one line");

        assertThat(fromArray).isEqualTo(new Metrics("c", 1, 1, 0, null, false));
        assertThat(fromNull).isEqualTo(fromArray);
    }

    @Test
    void countLinesCountsNewlinesPlusOne() {
        assertThat(MetricsNormalizer.countLines("")).isEqualTo(1);
        assertThat(MetricsNormalizer.countLines("a\n")).isEqualTo(2);
        assertThat(MetricsNormalizer.countLines("a\r\nb\r\nc")).isEqualTo(3);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }
}
