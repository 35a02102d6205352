package com.raceresults.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * One schedulable source document.
 *
 * JSON layout matches crawl_targets.json:
 *  - "url" holds the document locator
 *  - "crawlPolicy" holds the crawl window
 *  - timestamps are ISO-8601 with offset
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "url", "status", "event", "crawlPolicy", "tracking", "contentHash"})
public class CrawlTarget {

    private String id;

    @JsonProperty("url")
    private String locator;

    @Builder.Default
    private TargetStatus status = TargetStatus.QUEUED;

    private Event event;

    @JsonProperty("crawlPolicy")
    @Builder.Default
    private CrawlWindow window = new CrawlWindow();

    @Builder.Default
    private Tracking tracking = new Tracking();

    /** SHA-256 of the last document that was extracted successfully for this target. */
    private String contentHash;

    /** A stored null block reads as an empty one. */
    @JsonProperty("crawlPolicy")
    public void setWindow(CrawlWindow window) {
        this.window = window == null ? new CrawlWindow() : window;
    }

    public void setTracking(Tracking tracking) {
        this.tracking = tracking == null ? new Tracking() : tracking;
    }

    @JsonIgnore
    public boolean hasIdentity() {
        return id != null && !id.isBlank() && locator != null && !locator.isBlank();
    }

    /**
     * Moves the target along the state machine.
     *
     * @throws IllegalStateException when the transition is not in the table
     */
    public void transitionTo(TargetStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Target " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    /**
     * Gives up an in-flight attempt without an outcome, restoring the status it started from.
     */
    public void abandonAttempt(TargetStatus previous) {
        if (status != TargetStatus.PROCESSING || previous == null || !previous.isSelectable()) {
            throw new IllegalStateException("Target " + id + " cannot return from " + status + " to " + previous);
        }
        this.status = previous;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Event {
        private String startDate;
        private String endDate;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrawlWindow {
        private OffsetDateTime validFrom;
        private OffsetDateTime validUntil;

        @JsonIgnore
        public boolean isBounded() {
            return validFrom != null && validUntil != null;
        }

        /** Inclusive at both ends; an open window contains every instant. */
        public boolean contains(OffsetDateTime now) {
            if (!isBounded()) return true;
            return !now.isBefore(validFrom) && !now.isAfter(validUntil);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"createdAt", "updatedAt", "attemptCount", "lastAttemptAt", "succeededAt"})
    public static class Tracking {
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;
        private int attemptCount;
        private OffsetDateTime lastAttemptAt;
        private OffsetDateTime succeededAt;

        public void recordAttempt(OffsetDateTime now) {
            lastAttemptAt = now;
            updatedAt = now;
            attemptCount++;
        }

        /** Only the first success is kept. */
        public void recordSuccess(OffsetDateTime now) {
            if (succeededAt == null) {
                succeededAt = now;
            }
        }
    }
}
