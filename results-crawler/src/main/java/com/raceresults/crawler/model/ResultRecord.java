package com.raceresults.crawler.model;

import lombok.Builder;
import lombok.Data;

/**
 * One extracted result row as it lives in the master dataset.
 *
 * Column mapping (master CSV header → field):
 *  - Name → subjectName, Category → category
 *  - RaceName → eventName, Event → discipline
 *  - Location, Rank, Date, SourceUrl → location, rank, date, sourceLocator
 *
 * Rank is kept verbatim: an ordinal ("3") or a special value ("DNF", "DSQ", ...).
 */
@Data
@Builder(toBuilder = true)
public class ResultRecord {

    private String subjectName;
    private String category;
    private String eventName;
    private String discipline;
    private String location;
    private String rank;
    private String date;
    private String sourceLocator;

    public Key key() {
        return new Key(subjectName, eventName, discipline);
    }

    /** Two records with the same key describe the same result. */
    public record Key(String subjectName, String eventName, String discipline) {}
}
