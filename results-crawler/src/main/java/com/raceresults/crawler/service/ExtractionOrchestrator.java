package com.raceresults.crawler.service;

import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.model.TargetOutcome;
import com.raceresults.crawler.model.TargetStatus;
import com.raceresults.crawler.output.ResultCsvFormat;
import com.raceresults.crawler.output.StagingArea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Drives a single target through download → dedup → extract → normalize → stage and
 * records the attempt on the target's tracking block.
 *
 * Only the in-memory target is changed; persisting it is the caller's job. There are no
 * retries here: a Failed target is picked up again by a later run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExtractionOrchestrator {

    private final DocumentFetcher documentFetcher;
    private final ContentHasher contentHasher;
    private final ExtractionService extractionService;
    private final ExtractionOutputNormalizer normalizer;
    private final StagingArea stagingArea;
    private final CrawlerProperties properties;

    public TargetOutcome process(CrawlTarget target, CrawlRunContext context) {
        Optional<String> invalid = validate(target);
        if (invalid.isPresent()) {
            log.warn("Skipping invalid target {}: {}", target.getId(), invalid.get());
            return TargetOutcome.invalid(target.getId(), invalid.get());
        }

        String id = target.getId();
        TargetStatus startedFrom = target.getStatus();
        log.info("Processing target {} ({})", id, target.getLocator());

        target.transitionTo(TargetStatus.PROCESSING);
        target.getTracking().recordAttempt(context.now());

        try {
            byte[] document = documentFetcher.fetch(target.getLocator());
            String fingerprint = contentHasher.hash(document);

            Optional<String> original = context.duplicateOf(fingerprint, id);
            if (original.isPresent()) {
                return handleDuplicate(target, startedFrom, original.get(), context);
            }

            String raw = extractionService.extract(document, context.criteria());
            ExtractionOutputNormalizer.ExtractedTable table = normalizer.parse(raw);
            stage(target, table);

            target.transitionTo(TargetStatus.PROCESSED);
            target.getTracking().recordSuccess(context.now());
            target.setContentHash(fingerprint);
            context.registerExtracted(fingerprint, id);

            if (table.isEmpty()) {
                log.info("Target {}: no monitored results in document", id);
            }
            return TargetOutcome.succeeded(id, table.rows().size());

        } catch (DocumentFetchException e) {
            return fail(target, "transport: " + e.getMessage());
        } catch (ExtractionException e) {
            return fail(target, "extraction: " + e.getMessage());
        } catch (UncheckedIOException e) {
            return fail(target, "staging: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error processing target {}: {}", id, e.getMessage(), e);
            return fail(target, "unexpected: " + e.getMessage());
        }
    }

    private Optional<String> validate(CrawlTarget target) {
        if (!target.hasIdentity()) {
            return Optional.of("target has no id or url");
        }
        if (!StagingArea.isValidTargetId(target.getId())) {
            return Optional.of("id may only contain letters, digits, '.', '_' and '-': " + target.getId());
        }
        try {
            URI uri = URI.create(target.getLocator().trim());
            if (!uri.isAbsolute()) {
                return Optional.of("url is not absolute: " + target.getLocator());
            }
        } catch (IllegalArgumentException e) {
            return Optional.of("malformed url: " + target.getLocator());
        }
        if (target.getStatus() == null) {
            return Optional.of("status is missing");
        }
        if (target.getTracking() == null) {
            return Optional.of("tracking is missing");
        }
        return Optional.empty();
    }

    private TargetOutcome handleDuplicate(CrawlTarget target, TargetStatus startedFrom, String originalId,
                                          CrawlRunContext context) {
        String reason = "same document content as target " + originalId;
        switch (properties.getRun().getDuplicateDocumentPolicy()) {
            case MARK_PROCESSED -> {
                target.transitionTo(TargetStatus.PROCESSED);
                target.getTracking().recordSuccess(context.now());
            }
            case LEAVE_PENDING -> target.abandonAttempt(startedFrom);
        }
        log.info("Skipping duplicate document for target {}: {} (now {})",
                target.getId(), reason, target.getStatus().value());
        return TargetOutcome.duplicate(target.getId(), reason);
    }

    /**
     * Appends the locator as the SourceUrl column. Rows are padded or cut to the header width
     * first so the provenance value always lands in its own column.
     */
    private void stage(CrawlTarget target, ExtractionOutputNormalizer.ExtractedTable table) {
        String[] header = Arrays.copyOf(table.header(), table.header().length + 1);
        header[header.length - 1] = ResultCsvFormat.SOURCE_URL;

        int width = table.header().length;
        List<String[]> rows = table.rows().stream()
                .map(row -> {
                    String[] out = Arrays.copyOf(row, width + 1);
                    for (int i = row.length; i < width; i++) {
                        out[i] = "";
                    }
                    out[width] = target.getLocator();
                    return out;
                })
                .toList();

        stagingArea.write(target.getId(), header, rows);
    }

    private TargetOutcome fail(CrawlTarget target, String reason) {
        target.transitionTo(TargetStatus.FAILED);
        log.warn("Target {} failed: {}", target.getId(), reason);
        return TargetOutcome.failed(target.getId(), reason);
    }
}
