package com.raceresults.crawler.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveRunException extends CrawlerException {

    public ActiveRunException(String message) {
        super(message);
    }
}
