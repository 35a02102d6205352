package com.raceresults.crawler.output;

import com.opencsv.exceptions.CsvException;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.ResultRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * The durable master CSV (default data/ski-data.csv).
 * A missing file reads as an empty dataset; a present but unreadable one is an error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MasterDatasetFile {

    private final CrawlerProperties properties;

    public Path path() {
        return Paths.get(properties.getData().getMasterFile());
    }

    public List<ResultRecord> read() {
        Path path = path();
        if (!Files.exists(path)) {
            log.info("Master file not found at {}, a new one will be created", path);
            return List.of();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<ResultRecord> records = ResultCsvFormat.read(reader);
            log.info("Read {} records from {}", records.size(), path.getFileName());
            return records;
        } catch (IOException | CsvException | IllegalArgumentException e) {
            throw new MasterDatasetException("Cannot read master dataset " + path + ": " + e.getMessage(), e);
        }
    }

    public void write(List<ResultRecord> records) {
        Path path = path();
        try {
            AtomicFiles.replace(path, writer -> ResultCsvFormat.write(writer, records));
        } catch (IOException e) {
            throw new MasterDatasetException("Cannot write master dataset " + path, e);
        }
        log.info("Written {} records to master dataset: {}", records.size(), path);
    }
}
