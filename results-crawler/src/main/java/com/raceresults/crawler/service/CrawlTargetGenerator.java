package com.raceresults.crawler.service;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.model.TargetStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds crawl targets from an event calendar CSV.
 *
 * Calendar format (semicolon separated by default):
 *   V-Nr;Datum;...           e.g. 1396;2025-02-01;...
 *
 * Each row becomes a Queued target:
 *  - id          = idPrefix + V-Nr, e.g. kwo2025-1396
 *  - url         = the row's "url" column if present, otherwise urlTemplate with {id} replaced
 *  - crawlPolicy = [event date 00:00Z, event date + windowYears at 23:59:59Z]
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CrawlTargetGenerator {

    private static final String URL_COLUMN = "url";

    private final CrawlerProperties properties;

    public List<CrawlTarget> generate(OffsetDateTime now) {
        Path path = Paths.get(properties.getGenerator().getCalendarCsv());
        log.info("Reading event calendar from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return generate(reader, now);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read event calendar " + path, e);
        }
    }

    public List<CrawlTarget> generate(Reader calendar, OffsetDateTime now) throws IOException {
        CrawlerProperties.Generator config = properties.getGenerator();
        List<String[]> rows;
        try (CSVReader reader = new CSVReaderBuilder(calendar)
                .withCSVParser(new CSVParserBuilder().withSeparator(config.getDelimiter()).build())
                .build()) {
            rows = reader.readAll();
        } catch (CsvException e) {
            throw new IOException("Event calendar is not valid CSV: " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            return List.of();
        }

        String[] header = rows.get(0);
        int idCol = columnIndex(header, config.getIdColumn());
        int dateCol = columnIndex(header, config.getDateColumn());
        int urlCol = columnIndex(header, URL_COLUMN);
        if (idCol < 0 || dateCol < 0) {
            throw new IOException("Event calendar needs columns " + config.getIdColumn() + " and " + config.getDateColumn());
        }

        List<CrawlTarget> targets = new ArrayList<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] cols = rows.get(i);
            String eventNo = safeGet(cols, idCol);
            String date = safeGet(cols, dateCol);
            if (eventNo.isBlank()) continue;
            try {
                LocalDate eventDate = LocalDate.parse(date);
                String url = urlCol >= 0 && !safeGet(cols, urlCol).isBlank()
                        ? safeGet(cols, urlCol)
                        : config.getUrlTemplate().replace("{id}", eventNo);
                targets.add(buildTarget(config.getIdPrefix() + eventNo, url, eventDate, now));
            } catch (DateTimeParseException e) {
                log.warn("Could not process calendar row {}: invalid date '{}'", i, date);
            }
        }

        log.info("Generated {} crawl targets", targets.size());
        return targets;
    }

    private CrawlTarget buildTarget(String id, String url, LocalDate eventDate, OffsetDateTime now) {
        OffsetDateTime validFrom = eventDate.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime validUntil = eventDate.plusYears(properties.getGenerator().getWindowYears())
                .atTime(LocalTime.of(23, 59, 59))
                .atOffset(ZoneOffset.UTC);

        return CrawlTarget.builder()
                .id(id)
                .locator(url)
                .status(TargetStatus.QUEUED)
                .event(new CrawlTarget.Event(eventDate.toString(), eventDate.toString()))
                .window(new CrawlTarget.CrawlWindow(validFrom, validUntil))
                .tracking(new CrawlTarget.Tracking(now, now, 0, null, null))
                .build();
    }

    private static int columnIndex(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && header[i].replace("\uFEFF", "").trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String safeGet(String[] cols, int idx) {
        if (idx < 0 || idx >= cols.length || cols[idx] == null) return "";
        return cols[idx].trim();
    }
}
