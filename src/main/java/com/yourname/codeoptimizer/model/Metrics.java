package com.yourname.codeoptimizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Metrics(
    String language,
    @JsonProperty("loc_before") int locBefore,
    @JsonProperty("loc_after") int locAfter,
    int reduction,
    @JsonProperty("redundant_removed") Integer redundantRemoved,
    @JsonProperty("security_improved") boolean securityImproved
) {}
