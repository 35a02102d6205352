package com.raceresults.crawler.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.output.AtomicFiles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable list of crawl targets (default data/crawl_targets.json).
 *
 * The whole list is read and written as one unit. Callers mutate the loaded objects in
 * memory and call save() once at the end of a run, so a crash mid-run leaves the previous
 * file untouched.
 */
@Component
@Slf4j
public class TargetStore {

    private static final TypeReference<List<CrawlTarget>> TARGET_LIST = new TypeReference<>() {};

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public TargetStore(CrawlerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return Paths.get(properties.getData().getTargetsFile());
    }

    public boolean exists() {
        return Files.exists(path());
    }

    /**
     * @throws TargetStoreException   file missing or not valid JSON
     * @throws InvalidTargetException a target carries an unknown, null or absent status
     */
    public List<CrawlTarget> load() {
        Path path = path();
        log.info("Loading crawl targets from {}", path);
        if (!Files.exists(path)) {
            throw new TargetStoreException("Target list not found: " + path, null);
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new TargetStoreException("Target list is empty JSON: " + path, null);
            }
            if (!root.isArray()) {
                throw new TargetStoreException("Target list is not a JSON array: " + path, null);
            }
            requireStatus(root);
            List<CrawlTarget> targets = objectMapper.readerFor(TARGET_LIST).readValue(root);
            log.info("Loaded {} crawl targets", targets.size());
            return new ArrayList<>(targets);
        } catch (IOException e) {
            InvalidTargetException invalid = findInvalidTarget(e);
            if (invalid != null) {
                throw invalid;
            }
            throw new TargetStoreException("Could not decode target list " + path + ": " + e.getMessage(), e);
        }
    }

    public void save(List<CrawlTarget> targets) {
        Path path = path();
        log.info("Saving {} crawl targets to {}", targets.size(), path);
        try {
            AtomicFiles.replace(path, writer -> objectMapper.writeValue(writer, targets));
        } catch (IOException e) {
            throw new TargetStoreException("Could not save target list " + path, e);
        }
    }

    /** The builder default must never stand in for a status the file does not carry. */
    private static void requireStatus(JsonNode targets) {
        for (int i = 0; i < targets.size(); i++) {
            JsonNode target = targets.get(i);
            if (!target.hasNonNull("status")) {
                String id = target.path("id").asText("#" + i);
                throw new InvalidTargetException("Target " + id + " has no status");
            }
        }
    }

    private static InvalidTargetException findInvalidTarget(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InvalidTargetException invalid) {
                return invalid;
            }
        }
        return null;
    }
}
