package com.example.docimp.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal decision recorded for one improve item.
 */
public enum ImprovementOutcome {
    @JsonProperty("accepted")
    ACCEPTED,
    @JsonProperty("skipped")
    SKIPPED,
    @JsonProperty("error")
    ERROR
}
