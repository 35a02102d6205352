package com.raceresults.crawler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Clubs and athletes whose results must be extracted from every document.
 * Loaded once per run and never modified.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MonitoringCriteria(List<String> clubs, List<String> athletes) {

    @JsonCreator
    public MonitoringCriteria(@JsonProperty("clubs") List<String> clubs,
                              @JsonProperty("athletes") List<String> athletes) {
        this.clubs = clubs == null ? List.of() : List.copyOf(clubs);
        this.athletes = athletes == null ? List.of() : List.copyOf(athletes);
    }

    public boolean isEmpty() {
        return clubs.isEmpty() && athletes.isEmpty();
    }
}
