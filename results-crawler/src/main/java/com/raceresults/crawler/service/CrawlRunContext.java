package com.raceresults.crawler.service;

import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.model.MonitoringCriteria;
import com.raceresults.crawler.model.TargetStatus;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State shared by all targets of one run: the criteria, the run's clock reading and the
 * fingerprints of documents already extracted (seeded from Processed targets).
 */
public class CrawlRunContext {

    private final MonitoringCriteria criteria;
    private final OffsetDateTime now;
    private final Map<String, String> extractedDocuments = new HashMap<>();

    public CrawlRunContext(MonitoringCriteria criteria, OffsetDateTime now) {
        this.criteria = criteria;
        this.now = now;
    }

    public static CrawlRunContext start(MonitoringCriteria criteria, OffsetDateTime now, List<CrawlTarget> targets) {
        CrawlRunContext context = new CrawlRunContext(criteria, now);
        for (CrawlTarget t : targets) {
            if (t.getStatus() == TargetStatus.PROCESSED && t.getContentHash() != null && t.getId() != null) {
                context.extractedDocuments.putIfAbsent(t.getContentHash(), t.getId());
            }
        }
        return context;
    }

    public MonitoringCriteria criteria() {
        return criteria;
    }

    public OffsetDateTime now() {
        return now;
    }

    /** The other target that already yielded this document, if any. */
    public Optional<String> duplicateOf(String fingerprint, String targetId) {
        String owner = extractedDocuments.get(fingerprint);
        if (owner == null || owner.equals(targetId)) {
            return Optional.empty();
        }
        return Optional.of(owner);
    }

    public void registerExtracted(String fingerprint, String targetId) {
        extractedDocuments.putIfAbsent(fingerprint, targetId);
    }
}
