package com.raceresults.crawler.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Result of one scheduling pass.
 *
 * @param merge null when no merge ran after the crawl
 */
public record RunSummary(
        String runId,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt,
        List<TargetOutcome> outcomes,
        boolean targetsSaved,
        boolean stopped,
        MergeSummary merge
) {

    public Map<TargetOutcome.Result, Long> countsByResult() {
        return outcomes.stream()
                .collect(Collectors.groupingBy(TargetOutcome::result, Collectors.counting()));
    }

    public long count(TargetOutcome.Result result) {
        return countsByResult().getOrDefault(result, 0L);
    }

    public RunSummary withMerge(MergeSummary mergeSummary) {
        return new RunSummary(runId, startedAt, completedAt, outcomes, targetsSaved, stopped, mergeSummary);
    }

    public Map<String, TargetOutcome> byTargetId() {
        return outcomes.stream()
                .collect(Collectors.toMap(TargetOutcome::targetId, Function.identity(), (a, b) -> b));
    }
}
