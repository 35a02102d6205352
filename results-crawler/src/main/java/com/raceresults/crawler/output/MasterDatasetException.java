package com.raceresults.crawler.output;

import com.raceresults.crawler.service.CrawlerException;

/** Master dataset could not be read or replaced. Fatal to the merge. */
public class MasterDatasetException extends CrawlerException {

    public MasterDatasetException(String message, Throwable cause) {
        super(message, cause);
    }
}
