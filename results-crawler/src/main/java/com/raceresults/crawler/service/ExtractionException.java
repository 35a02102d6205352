package com.raceresults.crawler.service;

/** The extraction service failed or returned output that cannot be staged. */
public class ExtractionException extends CrawlerException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
