package com.raceresults.crawler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.MonitoringCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads monitoring_targets.json: {"clubs": [...], "athletes": [...]}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MonitoringCriteriaLoader {

    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public MonitoringCriteria load() {
        Path path = Paths.get(properties.getData().getMonitoringFile());
        if (!Files.exists(path)) {
            throw new TargetStoreException("Monitoring criteria not found: " + path, null);
        }
        try {
            MonitoringCriteria criteria = objectMapper.readValue(path.toFile(), MonitoringCriteria.class);
            if (criteria == null || criteria.isEmpty()) {
                throw new TargetStoreException("Monitoring criteria lists no clubs or athletes: " + path, null);
            }
            log.info("Monitoring {} clubs and {} athletes", criteria.clubs().size(), criteria.athletes().size());
            return criteria;
        } catch (IOException e) {
            throw new TargetStoreException("Could not decode monitoring criteria " + path + ": " + e.getMessage(), e);
        }
    }
}
