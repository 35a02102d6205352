package com.raceresults.crawler.service;

import com.raceresults.crawler.model.MonitoringCriteria;

/**
 * Turns a result document into CSV text with the header
 * Name,Category,RaceName,Event,Location,Rank,Date.
 *
 * Implementations are built once per application and shared read-only by every run.
 * The returned text may still carry formatting noise such as markdown fences.
 */
public interface ExtractionService {

    /**
     * @throws ExtractionException on any service error, including timeouts
     */
    String extract(byte[] document, MonitoringCriteria criteria);
}
