package com.raceresults.crawler.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of one processed target waiting in the staging area.
 *
 * @param targetId      target the rows were extracted for (also the file name stem)
 * @param file          staged CSV file backing this set
 * @param records       rows in file order
 */
public record StagedResultSet(String targetId, Path file, List<ResultRecord> records) {}
