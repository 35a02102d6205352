package com.raceresults.crawler.service;

import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.MergeSummary;
import com.raceresults.crawler.model.ResultRecord;
import com.raceresults.crawler.model.StagedResultSet;
import com.raceresults.crawler.output.MasterDatasetFile;
import com.raceresults.crawler.output.StagedFileException;
import com.raceresults.crawler.output.StagingArea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Folds every staged file into the master dataset.
 *
 * The master is rebuilt from (existing master rows + staged rows), deduplicated on
 * (Name, RaceName, Event) with the later row winning, sorted by (Date, RaceName, Name) and
 * written atomically. Staged files are deleted only after that write succeeds, so a failed
 * merge can simply be run again.
 */
@Service
@Slf4j
public class StagingMergeEngine {

    static final Comparator<ResultRecord> MASTER_ORDER = Comparator
            .comparing(ResultRecord::getDate, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(ResultRecord::getEventName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(ResultRecord::getSubjectName, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

    private final StagingArea stagingArea;
    private final MasterDatasetFile masterFile;
    private final CrawlerProperties properties;

    private final AtomicBoolean merging = new AtomicBoolean(false);

    public StagingMergeEngine(StagingArea stagingArea, MasterDatasetFile masterFile, CrawlerProperties properties) {
        this.stagingArea = stagingArea;
        this.masterFile = masterFile;
        this.properties = properties;
    }

    /** Master rows after a fold, plus how many rows were dropped as duplicates. */
    public record Consolidated(List<ResultRecord> records, int duplicatesCollapsed) {}

    public MergeSummary merge() {
        if (!merging.compareAndSet(false, true)) {
            throw new ActiveRunException("A merge is already in progress");
        }
        try {
            return doMerge();
        } finally {
            merging.set(false);
        }
    }

    public boolean isMerging() {
        return merging.get();
    }

    /**
     * Pure fold: master rows first, then each staged set in order. Later rows replace earlier
     * rows with the same key and take their position; the sort is stable.
     */
    public static Consolidated consolidate(List<ResultRecord> master, List<StagedResultSet> staged) {
        Map<ResultRecord.Key, ResultRecord> byKey = new LinkedHashMap<>();
        int total = 0;
        for (ResultRecord r : master) {
            put(byKey, r);
            total++;
        }
        for (StagedResultSet set : staged) {
            for (ResultRecord r : set.records()) {
                put(byKey, r);
                total++;
            }
        }
        List<ResultRecord> records = new ArrayList<>(byKey.values());
        records.sort(MASTER_ORDER);
        return new Consolidated(records, total - records.size());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private MergeSummary doMerge() {
        log.info("Starting merge of {} into {}", stagingArea.directory(), masterFile.path());
        List<ResultRecord> master = masterFile.read();

        List<Path> files = stagingArea.listStagedFiles();
        if (files.isEmpty()) {
            log.info("No new files found in the staging directory");
            return MergeSummary.unchanged(master.size(), 0);
        }
        log.info("Found {} staged files to merge", files.size());

        List<StagedResultSet> staged = new ArrayList<>();
        int rejected = 0;
        for (Path file : files) {
            try {
                staged.add(stagingArea.read(file));
            } catch (StagedFileException e) {
                rejected++;
                reject(e);
            }
        }
        if (staged.isEmpty()) {
            log.warn("No readable staged files, master dataset left unchanged");
            return MergeSummary.unchanged(master.size(), rejected);
        }

        Consolidated result = consolidate(master, staged);
        masterFile.write(result.records());

        int stagedRows = 0;
        for (StagedResultSet set : staged) {
            stagedRows += set.records().size();
            try {
                stagingArea.delete(set.file());
                log.debug("Removed staged file {}", set.file().getFileName());
            } catch (IOException e) {
                log.warn("Merged but could not remove staged file {}: {}", set.file(), e.getMessage());
            }
        }

        MergeSummary summary = new MergeSummary(master.size(), staged.size(), stagedRows,
                result.duplicatesCollapsed(), rejected, result.records().size());
        log.info("Merge finished: master {} -> {} records, {} staged rows from {} files, {} duplicates collapsed, {} files rejected",
                summary.masterRowsBefore(), summary.masterRowsAfter(), summary.stagedRowsRead(),
                summary.stagedFilesMerged(), summary.duplicatesCollapsed(), summary.stagedFilesRejected());
        return summary;
    }

    private void reject(StagedFileException e) {
        Path file = e.getFile();
        switch (properties.getMerge().getRejectedFilePolicy()) {
            case LEAVE -> log.warn("{}. This file will be left in staging.", e.getMessage());
            case QUARANTINE -> {
                try {
                    Path moved = stagingArea.quarantine(file);
                    log.warn("{}. Moved to {}", e.getMessage(), moved);
                } catch (IOException io) {
                    log.error("{}. Quarantine failed, file left in staging: {}", e.getMessage(), io.getMessage(), io);
                }
            }
        }
    }

    private static void put(Map<ResultRecord.Key, ResultRecord> byKey, ResultRecord record) {
        ResultRecord.Key key = record.key();
        byKey.remove(key);
        byKey.put(key, record);
    }
}
