package com.raceresults.crawler.output;

import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.ResultRecord;
import com.raceresults.crawler.model.StagedResultSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Transient per-target output awaiting consolidation.
 *
 * File layout: {stagingDir}/{targetId}.csv, e.g. data/staging/kwo2025-1396.csv
 *
 * Files are written by the orchestrator and removed only by the merge engine, after the
 * master dataset has been replaced. Dry-run output goes to a separate directory that the
 * merge engine never reads.
 */
@Component
@Slf4j
public class StagingArea {

    private static final String SUFFIX = ".csv";
    private static final Pattern TARGET_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final CrawlerProperties properties;

    public StagingArea(CrawlerProperties properties) {
        this.properties = properties;
    }

    /** The directory the merge engine consumes. */
    public Path directory() {
        return Paths.get(properties.getData().getStagingDir());
    }

    /** Where new output is written: the dry-run directory while extraction runs in DRY_RUN mode. */
    public Path writeDirectory() {
        if (properties.getExtraction().isDryRun()) {
            return Paths.get(properties.getData().getDryRunStagingDir());
        }
        return directory();
    }

    /**
     * Writes the authoritative staged output for a target, replacing any earlier file.
     */
    public Path write(String targetId, String[] header, List<String[]> rows) {
        Path path = writeDirectory().resolve(fileNameFor(targetId));
        try {
            AtomicFiles.replace(path, writer -> {
                try (CSVWriter csv = ResultCsvFormat.newWriter(writer)) {
                    csv.writeNext(header);
                    for (String[] row : rows) {
                        csv.writeNext(row);
                    }
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Staging write failed for target " + targetId, e);
        }
        log.info("Staged {} rows for target {} at {}", rows.size(), targetId, path);
        return path;
    }

    /**
     * Staged files ordered by modification time, then name, so the most recently processed
     * target is merged last whatever order the file system lists them in.
     */
    public List<Path> listStagedFiles() {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.comparing(StagingArea::modifiedTime)
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list staging directory " + dir, e);
        }
    }

    public StagedResultSet read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<ResultRecord> records = ResultCsvFormat.read(reader);
            return new StagedResultSet(targetIdOf(file), file, records);
        } catch (IOException | CsvException | IllegalArgumentException e) {
            throw new StagedFileException(file, "Unreadable staged file " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public void delete(Path file) throws IOException {
        Files.deleteIfExists(file);
    }

    /** Moves a rejected file out of the staging directory for manual inspection. */
    public Path quarantine(Path file) throws IOException {
        Path dir = Paths.get(properties.getData().getQuarantineDir());
        Files.createDirectories(dir);
        Path dest = dir.resolve(file.getFileName());
        Files.move(file, dest, StandardCopyOption.REPLACE_EXISTING);
        return dest;
    }

    /** Ids map one-to-one onto file names, so only file-name-safe characters are accepted. */
    public static boolean isValidTargetId(String targetId) {
        return targetId != null && TARGET_ID.matcher(targetId).matches() && !targetId.startsWith(".");
    }

    static String fileNameFor(String targetId) {
        if (!isValidTargetId(targetId)) {
            throw new IllegalArgumentException("Target id cannot be used as a staged file name: " + targetId);
        }
        return targetId + SUFFIX;
    }

    static String targetIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(SUFFIX) ? name.substring(0, name.length() - SUFFIX.length()) : name;
    }

    private static FileTime modifiedTime(Path p) {
        try {
            return Files.getLastModifiedTime(p);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
