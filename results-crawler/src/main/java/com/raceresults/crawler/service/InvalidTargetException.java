package com.raceresults.crawler.service;

/** Malformed target: missing id or locator, or an unknown status value. */
public class InvalidTargetException extends CrawlerException {

    public InvalidTargetException(String message) {
        super(message);
    }
}
