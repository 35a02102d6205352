package com.raceresults.crawler.service;

/**
 * The document could not be fetched.
 * statusCode is 0 for transport failures (connect error, timeout, interrupted).
 */
public class DocumentFetchException extends CrawlerException {

    private final int statusCode;

    public DocumentFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DocumentFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return statusCode == 0 || statusCode == 429 || statusCode >= 500;
    }
}
