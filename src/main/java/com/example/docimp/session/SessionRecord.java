package com.example.docimp.session;

import com.example.docimp.tracking.FileSnapshot;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Envelope shared by audit and improve session records. Fields this version does not
 * know about are kept in {@link #getExtras()} and written back on save.
 */
public abstract class SessionRecord {
    public static final String DEFAULT_SCHEMA_VERSION = "1.0";

    @JsonProperty("session_id")
    private String sessionId;
    @JsonProperty("schema_version")
    private String schemaVersion = DEFAULT_SCHEMA_VERSION;
    @JsonProperty("started_at")
    private String startedAt;
    @JsonProperty("current_index")
    private int currentIndex;
    @JsonProperty("total_items")
    private int totalItems;
    @JsonProperty("file_snapshot")
    private Map<String, FileSnapshot> fileSnapshot = new LinkedHashMap<>();
    @JsonProperty("config")
    private Map<String, Object> config = new LinkedHashMap<>();
    @JsonProperty("completed_at")
    private String completedAt;

    private final Map<String, Object> extras = new LinkedHashMap<>();

    protected SessionRecord() {
    }

    @JsonIgnore
    public abstract SessionType getSessionType();

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(String schemaVersion) {
        this.schemaVersion = schemaVersion == null ? DEFAULT_SCHEMA_VERSION : schemaVersion;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public void setCurrentIndex(int currentIndex) {
        this.currentIndex = currentIndex;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public void setTotalItems(int totalItems) {
        this.totalItems = totalItems;
    }

    public Map<String, FileSnapshot> getFileSnapshot() {
        return fileSnapshot;
    }

    public void setFileSnapshot(Map<String, FileSnapshot> fileSnapshot) {
        this.fileSnapshot = fileSnapshot == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fileSnapshot);
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public void setConfig(Map<String, Object> config) {
        this.config = config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }

    public String getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(String completedAt) {
        this.completedAt = completedAt;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return completedAt != null;
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
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SessionRecord that = (SessionRecord) o;
        return currentIndex == that.currentIndex
                && totalItems == that.totalItems
                && Objects.equals(sessionId, that.sessionId)
                && Objects.equals(schemaVersion, that.schemaVersion)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(fileSnapshot, that.fileSnapshot)
                && Objects.equals(config, that.config)
                && Objects.equals(completedAt, that.completedAt)
                && Objects.equals(extras, that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, schemaVersion, startedAt, currentIndex, totalItems, fileSnapshot, config,
                completedAt, extras);
    }
}
