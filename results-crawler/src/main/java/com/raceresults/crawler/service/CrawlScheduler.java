package com.raceresults.crawler.service;

import com.raceresults.crawler.model.CrawlTarget;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Picks the targets a run should attempt.
 *
 * A target is selected when its status is Queued or Failed and, if both window bounds are
 * set, validFrom <= now <= validUntil. Nothing is mutated and the input order is kept.
 */
@Component
public class CrawlScheduler {

    public List<CrawlTarget> select(List<CrawlTarget> targets, OffsetDateTime now) {
        return targets.stream()
                .filter(t -> isEligible(t, now))
                .toList();
    }

    public boolean isEligible(CrawlTarget target, OffsetDateTime now) {
        return skipReason(target, now).isEmpty();
    }

    /** Why a target is not eligible, empty when it is. */
    public Optional<String> skipReason(CrawlTarget target, OffsetDateTime now) {
        if (target.getStatus() == null || !target.getStatus().isSelectable()) {
            return Optional.of("status is '" + (target.getStatus() == null ? null : target.getStatus().value()) + "'");
        }
        CrawlTarget.CrawlWindow window = target.getWindow();
        if (window == null || window.contains(now)) {
            return Optional.empty();
        }
        if (now.isBefore(window.getValidFrom())) {
            return Optional.of("crawl window opens at " + window.getValidFrom());
        }
        return Optional.of("crawl window closed at " + window.getValidUntil());
    }
}
