package com.raceresults.crawler.model;

/**
 * What happened to one target during a run. Logged per target and returned in the run summary.
 */
public record TargetOutcome(String targetId, Result result, int rowCount, String reason) {

    public enum Result {
        SKIPPED, SUCCEEDED, FAILED, DUPLICATE, INVALID
    }

    public static TargetOutcome skipped(String targetId, String reason) {
        return new TargetOutcome(targetId, Result.SKIPPED, 0, reason);
    }

    public static TargetOutcome succeeded(String targetId, int rowCount) {
        return new TargetOutcome(targetId, Result.SUCCEEDED, rowCount, null);
    }

    public static TargetOutcome failed(String targetId, String reason) {
        return new TargetOutcome(targetId, Result.FAILED, 0, reason);
    }

    public static TargetOutcome duplicate(String targetId, String reason) {
        return new TargetOutcome(targetId, Result.DUPLICATE, 0, reason);
    }

    public static TargetOutcome invalid(String targetId, String reason) {
        return new TargetOutcome(targetId, Result.INVALID, 0, reason);
    }
}
