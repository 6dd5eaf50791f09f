package com.example.docimp.session;

import com.example.docimp.io.Timestamps;
import com.example.docimp.tracking.FileSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Progress of an audit run. {@code partial_ratings} maps file to item to a quality
 * rating from 1 to 4, or {@code null} when the item was skipped or not reached yet.
 */
public class AuditSession extends SessionRecord {
    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 4;

    @JsonProperty("partial_ratings")
    private Map<String, Map<String, Integer>> partialRatings = new LinkedHashMap<>();

    public AuditSession() {
    }

    public static AuditSession createInitial(String sessionId,
                                             List<SessionItem> items,
                                             Map<String, FileSnapshot> fileSnapshot,
                                             Map<String, Object> config) {
        return createInitial(sessionId, items, fileSnapshot, config, Clock.systemUTC());
    }

    /**
     * Starts a session at index 0 with an unrated entry for every item.
     */
    public static AuditSession createInitial(String sessionId,
                                             List<SessionItem> items,
                                             Map<String, FileSnapshot> fileSnapshot,
                                             Map<String, Object> config,
                                             Clock clock) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("An audit session needs at least one item");
        }
        AuditSession session = new AuditSession();
        session.setSessionId(sessionId);
        session.setStartedAt(Timestamps.now(clock));
        session.setCurrentIndex(0);
        session.setTotalItems(items.size());
        for (SessionItem item : items) {
            session.partialRatings.computeIfAbsent(item.filepath(), ignored -> new LinkedHashMap<>()).put(item.name(), null);
        }
        session.setFileSnapshot(fileSnapshot);
        session.setConfig(config);
        return session;
    }

    @Override
    @JsonIgnore
    public SessionType getSessionType() {
        return SessionType.AUDIT;
    }

    public Map<String, Map<String, Integer>> getPartialRatings() {
        return partialRatings;
    }

    public void setPartialRatings(Map<String, Map<String, Integer>> partialRatings) {
        this.partialRatings = partialRatings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(partialRatings);
    }

    /**
     * Records a rating, or {@code null} for an explicit skip.
     */
    public void recordRating(SessionItem item, Integer rating) {
        if (rating != null && (rating < MIN_RATING || rating > MAX_RATING)) {
            throw new IllegalArgumentException("Rating must be between 1 and 4, got " + rating);
        }
        partialRatings.computeIfAbsent(item.filepath(), ignored -> new LinkedHashMap<>()).put(item.name(), rating);
    }

    public Integer ratingFor(String filepath, String itemName) {
        Map<String, Integer> ratings = partialRatings.get(filepath);
        return ratings == null ? null : ratings.get(itemName);
    }

    @JsonIgnore
    public int getRatedCount() {
        int count = 0;
        for (Map<String, Integer> ratings : partialRatings.values()) {
            for (Integer rating : ratings.values()) {
                if (rating != null) {
                    count++;
                }
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Objects.equals(partialRatings, ((AuditSession) o).partialRatings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), partialRatings);
    }
}
