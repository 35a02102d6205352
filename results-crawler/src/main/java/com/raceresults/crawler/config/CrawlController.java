package com.raceresults.crawler.config;

import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.service.CrawlRunService;
import com.raceresults.crawler.service.CrawlScheduler;
import com.raceresults.crawler.service.StagingMergeEngine;
import com.raceresults.crawler.service.TargetStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CrawlController {

    private final CrawlRunService crawlRunService;
    private final StagingMergeEngine mergeEngine;
    private final TargetStore targetStore;
    private final CrawlScheduler scheduler;
    private final CrawlerProperties properties;
    private final Clock clock;

    // ── Triggers ──────────────────────────────────────────────────────────────

    @PostMapping("/crawl/run")
    public ResponseEntity<Map<String, String>> triggerRun() {
        if (crawlRunService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("error", "a crawl run is already in progress"));
        }
        new Thread(() -> runQuietly("crawl run", crawlRunService::runAndMerge), "manual-crawl-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "action", "run"));
    }

    @PostMapping("/crawl/stop")
    public ResponseEntity<Map<String, String>> stopRun() {
        crawlRunService.requestStop();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "action", "stop"));
    }

    @PostMapping("/crawl/merge")
    public ResponseEntity<Map<String, String>> triggerMerge() {
        if (mergeEngine.isMerging()) {
            return ResponseEntity.status(409).body(Map.of("error", "a merge is already in progress"));
        }
        new Thread(() -> runQuietly("merge", mergeEngine::merge), "manual-merge").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "action", "merge"));
    }

    @PostMapping("/crawl/targets/generate")
    public ResponseEntity<Map<String, String>> generateTargets() {
        if (crawlRunService.isRunning()) {
            return ResponseEntity.status(409).body(Map.of("error", "a crawl run is in progress, target list is locked"));
        }
        new Thread(() -> runQuietly("target generation", crawlRunService::generateTargets), "manual-generate").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "action", "generate"));
    }

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/crawl/targets")
    public ResponseEntity<?> targets() {
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<Map<String, Object>> view = targetStore.load().stream()
                    .map(t -> targetView(t, now))
                    .toList();
            return ResponseEntity.ok(view);
        } catch (Exception e) {
            log.error("Could not list targets: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/crawl/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "race-results-crawler",
                "running", crawlRunService.isRunning(),
                "merging", mergeEngine.isMerging(),
                "extractionMode", properties.getExtraction().getMode().name(),
                "schedule", properties.getScheduling().getCron()
        ));
    }

    private Map<String, Object> targetView(CrawlTarget t, OffsetDateTime now) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", t.getId());
        view.put("url", t.getLocator());
        view.put("status", t.getStatus() == null ? null : t.getStatus().value());
        view.put("eligible", t.getStatus() != null && scheduler.isEligible(t, now));
        CrawlTarget.Tracking tracking = t.getTracking();
        view.put("attemptCount", tracking == null ? 0 : tracking.getAttemptCount());
        view.put("lastAttemptAt", tracking == null ? null : tracking.getLastAttemptAt());
        view.put("succeededAt", tracking == null ? null : tracking.getSucceededAt());
        return view;
    }

    private void runQuietly(String action, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Manual {} failed: {}", action, e.getMessage(), e);
        }
    }
}
