package com.example.docimp.session;

import com.example.docimp.io.Timestamps;
import com.example.docimp.tracking.FileSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Progress of an improve run, linked to the transaction that records its file writes.
 */
public class ImproveSession extends SessionRecord {
    @JsonProperty("transaction_id")
    private String transactionId;
    @JsonProperty("partial_improvements")
    private Map<String, Map<String, ImprovementStatus>> partialImprovements = new LinkedHashMap<>();
    @JsonProperty("previous_session_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String previousSessionId;

    public ImproveSession() {
    }

    public static ImproveSession createInitial(String sessionId,
                                               String transactionId,
                                               List<SessionItem> items,
                                               Map<String, FileSnapshot> fileSnapshot,
                                               Map<String, Object> config) {
        return createInitial(sessionId, transactionId, items, fileSnapshot, config, Clock.systemUTC());
    }

    /**
     * Starts a session at index 0 with a pending entry for every item.
     */
    public static ImproveSession createInitial(String sessionId,
                                               String transactionId,
                                               List<SessionItem> items,
                                               Map<String, FileSnapshot> fileSnapshot,
                                               Map<String, Object> config,
                                               Clock clock) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("An improve session needs at least one item");
        }
        ImproveSession session = new ImproveSession();
        session.setSessionId(sessionId);
        session.transactionId = transactionId;
        session.setStartedAt(Timestamps.now(clock));
        session.setCurrentIndex(0);
        session.setTotalItems(items.size());
        for (SessionItem item : items) {
            session.partialImprovements.computeIfAbsent(item.filepath(), ignored -> new LinkedHashMap<>())
                    .put(item.name(), ImprovementStatus.pending());
        }
        session.setFileSnapshot(fileSnapshot);
        session.setConfig(config);
        return session;
    }

    /**
     * Copies this session's progress under a new id, for resuming after the original
     * transaction was committed. The copy points back through {@code previous_session_id}.
     */
    public ImproveSession continueAs(String newSessionId) {
        ImproveSession next = new ImproveSession();
        next.setSessionId(newSessionId);
        next.setSchemaVersion(getSchemaVersion());
        next.setStartedAt(getStartedAt());
        next.setCurrentIndex(getCurrentIndex());
        next.setTotalItems(getTotalItems());
        next.setFileSnapshot(getFileSnapshot());
        next.setConfig(getConfig());
        next.setCompletedAt(getCompletedAt());
        next.getExtras().putAll(getExtras());
        next.transactionId = newSessionId;
        next.setPartialImprovements(partialImprovements);
        next.previousSessionId = getSessionId();
        return next;
    }

    @Override
    @JsonIgnore
    public SessionType getSessionType() {
        return SessionType.IMPROVE;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public void setTransactionId(String transactionId) {
        this.transactionId = transactionId;
    }

    public Map<String, Map<String, ImprovementStatus>> getPartialImprovements() {
        return partialImprovements;
    }

    public void setPartialImprovements(Map<String, Map<String, ImprovementStatus>> partialImprovements) {
        this.partialImprovements = new LinkedHashMap<>();
        if (partialImprovements != null) {
            partialImprovements.forEach((filepath, items) -> this.partialImprovements.put(filepath, new LinkedHashMap<>(items)));
        }
    }

    public String getPreviousSessionId() {
        return previousSessionId;
    }

    public void setPreviousSessionId(String previousSessionId) {
        this.previousSessionId = previousSessionId;
    }

    public void recordOutcome(SessionItem item, ImprovementOutcome outcome, String timestamp, String suggestion) {
        partialImprovements.computeIfAbsent(item.filepath(), ignored -> new LinkedHashMap<>())
                .put(item.name(), new ImprovementStatus(outcome, timestamp, suggestion));
    }

    public ImprovementStatus statusFor(String filepath, String itemName) {
        Map<String, ImprovementStatus> statuses = partialImprovements.get(filepath);
        return statuses == null ? null : statuses.get(itemName);
    }

    /**
     * Number of items with a recorded outcome of the given kind.
     */
    public int countOutcomes(ImprovementOutcome outcome) {
        int count = 0;
        for (Map<String, ImprovementStatus> statuses : partialImprovements.values()) {
            for (ImprovementStatus status : statuses.values()) {
                if (status != null && status.getStatus() == outcome) {
                    count++;
                }
            }
        }
        return count;
    }

    @JsonIgnore
    public int getRecordedCount() {
        int count = 0;
        for (Map<String, ImprovementStatus> statuses : partialImprovements.values()) {
            for (ImprovementStatus status : statuses.values()) {
                if (status != null && !status.isPending()) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        ImproveSession that = (ImproveSession) o;
        return Objects.equals(transactionId, that.transactionId)
                && Objects.equals(partialImprovements, that.partialImprovements)
                && Objects.equals(previousSessionId, that.previousSessionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), transactionId, partialImprovements, previousSessionId);
    }
}
