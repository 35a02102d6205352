package com.raceresults.crawler.service;

import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.model.MergeSummary;
import com.raceresults.crawler.model.MonitoringCriteria;
import com.raceresults.crawler.model.RunSummary;
import com.raceresults.crawler.model.TargetOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One crawl pass over the target list.
 *
 * load targets + criteria → select → process each selected target in order → save once.
 *
 * Load and save failures end the run without touching the stored list. Per-target failures
 * only mark that target Failed. Only one pass (or target generation) runs at a time.
 */
@Service
@Slf4j
public class CrawlRunService {

    private final TargetStore targetStore;
    private final MonitoringCriteriaLoader criteriaLoader;
    private final CrawlScheduler scheduler;
    private final ExtractionOrchestrator orchestrator;
    private final StagingMergeEngine mergeEngine;
    private final CrawlTargetGenerator targetGenerator;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    public CrawlRunService(TargetStore targetStore,
                           MonitoringCriteriaLoader criteriaLoader,
                           CrawlScheduler scheduler,
                           ExtractionOrchestrator orchestrator,
                           StagingMergeEngine mergeEngine,
                           CrawlTargetGenerator targetGenerator,
                           CrawlerProperties properties,
                           Clock clock) {
        this.targetStore = targetStore;
        this.criteriaLoader = criteriaLoader;
        this.scheduler = scheduler;
        this.orchestrator = orchestrator;
        this.mergeEngine = mergeEngine;
        this.targetGenerator = targetGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Crawl, then merge the staging area when crawler.merge.merge-after-crawl is set.
     * A dry run never merges, so the master dataset only ever receives real extraction output.
     */
    public RunSummary runAndMerge() {
        RunSummary summary = run();
        if (!properties.getMerge().isMergeAfterCrawl()) {
            return summary;
        }
        if (properties.getExtraction().isDryRun()) {
            log.info("DRY RUN: merge skipped, master dataset left unchanged");
            return summary;
        }
        MergeSummary merge = mergeEngine.merge();
        return summary.withMerge(merge);
    }

    public RunSummary run() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveRunException("A crawl run is already in progress");
        }
        try {
            stopRequested.set(false);
            return doRun();
        } finally {
            running.set(false);
        }
    }

    /** Asks the current run to stop before its next target. */
    public void requestStop() {
        if (running.get()) {
            log.info("Stop requested, the run will end after the current target");
            stopRequested.set(true);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Builds targets from the event calendar and appends those whose id is not yet stored.
     *
     * @return the targets that were added
     */
    public List<CrawlTarget> generateTargets() {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveRunException("A crawl run is in progress, target list is locked");
        }
        try {
            List<CrawlTarget> existing = targetStore.exists() ? targetStore.load() : new ArrayList<>();
            Set<String> knownIds = new HashSet<>();
            existing.forEach(t -> knownIds.add(t.getId()));

            List<CrawlTarget> added = targetGenerator.generate(OffsetDateTime.now(clock)).stream()
                    .filter(t -> knownIds.add(t.getId()))
                    .toList();

            if (added.isEmpty()) {
                log.info("No new crawl targets to add ({} already stored)", existing.size());
                return added;
            }
            List<CrawlTarget> all = new ArrayList<>(existing);
            all.addAll(added);
            targetStore.save(all);
            log.info("Added {} crawl targets, {} stored in total", added.size(), all.size());
            return added;
        } finally {
            running.set(false);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RunSummary doRun() {
        String runId = UUID.randomUUID().toString();
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean dryRun = properties.getExtraction().isDryRun();
        log.info("Starting crawl run {} ({} mode)", runId, dryRun ? "DRY-RUN" : "LIVE");

        List<CrawlTarget> targets = targetStore.load();
        MonitoringCriteria criteria = criteriaLoader.load();
        CrawlRunContext context = CrawlRunContext.start(criteria, now, targets);

        List<CrawlTarget> selected = scheduler.select(targets, now);
        log.info("{} of {} targets eligible at {}", selected.size(), targets.size(), now);

        List<TargetOutcome> outcomes = new ArrayList<>();
        for (CrawlTarget target : targets) {
            scheduler.skipReason(target, now).ifPresent(reason -> {
                log.info("Skipping target {}: {}", target.getId(), reason);
                outcomes.add(TargetOutcome.skipped(target.getId(), reason));
            });
        }

        boolean stopped = false;
        for (CrawlTarget target : selected) {
            if (stopRequested.get()) {
                stopped = true;
                log.info("Run {} stopped before target {}", runId, target.getId());
                break;
            }
            outcomes.add(orchestrator.process(target, context));
        }

        boolean save = !dryRun || properties.getRun().isSaveTargetsOnDryRun();
        if (save) {
            targetStore.save(targets);
        } else {
            log.info("DRY RUN: target list not saved");
        }

        RunSummary summary = new RunSummary(runId, now, OffsetDateTime.now(clock), List.copyOf(outcomes), save, stopped, null);
        logSummary(summary);
        return summary;
    }

    private void logSummary(RunSummary summary) {
        for (TargetOutcome o : summary.outcomes()) {
            if (o.result() == TargetOutcome.Result.SKIPPED) continue;
            log.info("Summary {}: {}{}", o.targetId(), o.result(),
                    o.reason() != null ? " - " + o.reason() : " (" + o.rowCount() + " rows)");
        }
        log.info("Crawl run {} finished: succeeded={}, failed={}, duplicate={}, invalid={}, skipped={}",
                summary.runId(),
                summary.count(TargetOutcome.Result.SUCCEEDED),
                summary.count(TargetOutcome.Result.FAILED),
                summary.count(TargetOutcome.Result.DUPLICATE),
                summary.count(TargetOutcome.Result.INVALID),
                summary.count(TargetOutcome.Result.SKIPPED));
    }
}
