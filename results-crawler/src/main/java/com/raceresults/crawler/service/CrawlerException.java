package com.raceresults.crawler.service;

/**
 * Root of the crawler's failure types. Per-target subclasses are caught by the run and turned
 * into a Failed target; persistence subclasses abort the run.
 */
public class CrawlerException extends RuntimeException {

    public CrawlerException(String message) {
        super(message);
    }

    public CrawlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
