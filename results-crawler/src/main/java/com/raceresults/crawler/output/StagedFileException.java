package com.raceresults.crawler.output;

import com.raceresults.crawler.service.CrawlerException;

import java.nio.file.Path;

/** A staged file is unreadable or lacks the key columns. Isolated; the merge carries on. */
public class StagedFileException extends CrawlerException {

    private final Path file;

    public StagedFileException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public StagedFileException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
