package com.raceresults.crawler.service;

import com.raceresults.crawler.model.MonitoringCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stand-in used when crawler.extraction.mode=DRY_RUN (the default).
 * Logs the prompt that would be sent and returns one canned result row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crawler.extraction.mode", havingValue = "DRY_RUN", matchIfMissing = true)
public class DryRunExtractionService implements ExtractionService {

    static final String CANNED_OUTPUT = """
            Name,Category,RaceName,Event,Location,Rank,Date
            John Doe,U16,Dry Run Race,Slalom,Nowhere,1,2025-01-01
            """;

    private final ExtractionPromptBuilder promptBuilder;

    @Override
    public String extract(byte[] document, MonitoringCriteria criteria) {
        log.info("DRY RUN: skipping extraction call. Prompt would be:\n{}\n[document of {} kB attached]",
                promptBuilder.build(criteria), Math.round(document.length / 10.24) / 100.0);
        return CANNED_OUTPUT;
    }
}
