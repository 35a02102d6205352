package com.raceresults.crawler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.raceresults.crawler.service.InvalidTargetException;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a crawl target, persisted as its lowercase name.
 *
 * <pre>
 *   QUEUED ──► PROCESSING ──► PROCESSED (terminal)
 *     │            │
 *     │            └────────► FAILED ──► (re-selected next run)
 *     └──────────────────────────────►
 * </pre>
 */
public enum TargetStatus {

    QUEUED("queued"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    FAILED("failed");

    private final String value;

    TargetStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Queued and Failed targets may be picked up by a run. */
    public boolean isSelectable() {
        return this == QUEUED || this == FAILED;
    }

    public boolean canTransitionTo(TargetStatus next) {
        return allowedTransitions().contains(next);
    }

    private Set<TargetStatus> allowedTransitions() {
        return switch (this) {
            case QUEUED, FAILED -> EnumSet.of(PROCESSING, PROCESSED, FAILED);
            case PROCESSING -> EnumSet.of(PROCESSED, FAILED);
            case PROCESSED -> EnumSet.noneOf(TargetStatus.class);
        };
    }

    @JsonCreator
    public static TargetStatus fromValue(String raw) {
        if (raw == null) {
            throw new InvalidTargetException("Target status is missing");
        }
        String normalised = raw.trim();
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(normalised))
                .findFirst()
                .orElseThrow(() -> new InvalidTargetException("Unrecognised target status: '" + raw + "'"));
    }
}
