package com.example.docimp.session;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one improve item. A pending item has no status and is written as {@code {}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImprovementStatus {
    private ImprovementOutcome status;
    private String timestamp;
    private String suggestion;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public ImprovementStatus() {
    }

    public ImprovementStatus(ImprovementOutcome status, String timestamp, String suggestion) {
        this.status = status;
        this.timestamp = timestamp;
        this.suggestion = suggestion;
    }

    public static ImprovementStatus pending() {
        return new ImprovementStatus();
    }

    public ImprovementOutcome getStatus() {
        return status;
    }

    public void setStatus(ImprovementOutcome status) {
        this.status = status;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getSuggestion() {
        return suggestion;
    }

    public void setSuggestion(String suggestion) {
        this.suggestion = suggestion;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == null;
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ImprovementStatus that)) {
            return false;
        }
        return status == that.status
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(suggestion, that.suggestion)
                && Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, timestamp, suggestion, extras);
    }
}
