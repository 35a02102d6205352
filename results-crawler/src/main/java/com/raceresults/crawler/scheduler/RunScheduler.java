package com.raceresults.crawler.scheduler;

import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.service.CrawlRunService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup crawl runs.
 *
 * Default schedule: every day at 03:00 UTC. Result lists appear a few days after a race and
 * targets stay eligible for their whole crawl window, so a daily pass is enough.
 *
 * Override with CRAWL_CRON env var or crawler.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunScheduler {

    private final CrawlRunService crawlRunService;
    private final CrawlerProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true - running crawl and merge");
            new Thread(this::scheduledRun, "startup-crawl-run").start();
        } else {
            log.info("Crawler ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${crawler.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled crawl run triggered");
        try {
            crawlRunService.runAndMerge();
        } catch (Exception e) {
            log.error("Scheduled crawl run failed: {}", e.getMessage(), e);
        }
    }
}
