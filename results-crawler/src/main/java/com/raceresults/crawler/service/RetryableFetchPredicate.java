package com.raceresults.crawler.service;

import java.util.function.Predicate;

/**
 * Retry predicate for the "documentSource" Resilience4j instance.
 * Retries transport failures, 429 and 5xx; a 404 or a malformed locator is final.
 */
public class RetryableFetchPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof DocumentFetchException fetch && fetch.isTransient();
    }
}
