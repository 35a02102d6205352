package com.raceresults.crawler.service;

/** Target list could not be loaded or saved. Fatal to the run. */
public class TargetStoreException extends CrawlerException {

    public TargetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
