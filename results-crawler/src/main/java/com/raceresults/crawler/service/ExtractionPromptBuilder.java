package com.raceresults.crawler.service;

import com.raceresults.crawler.model.MonitoringCriteria;
import com.raceresults.crawler.output.ResultCsvFormat;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the natural-language instruction sent along with the document.
 */
@Component
public class ExtractionPromptBuilder {

    public String build(MonitoringCriteria criteria) {
        List<String> parts = new ArrayList<>();
        parts.add("You are an expert in data extraction from PDF files.");
        parts.add("Analyze the attached PDF, which contains ski race results.");
        parts.add("Extract all results for the following clubs and athletes.");

        if (!criteria.clubs().isEmpty()) {
            parts.add("Clubs to extract: " + String.join(", ", criteria.clubs()));
        }
        if (!criteria.athletes().isEmpty()) {
            parts.add("Athletes to extract:");
            criteria.athletes().forEach(name -> parts.add("- " + name));
        }

        parts.add("");
        parts.add("Format the output as a CSV with these exact headers: "
                + String.join(",", ResultCsvFormat.EXTRACTION_HEADERS));
        parts.add("Use the rank as printed (a number, or DNF, DNS, DSQ for non-finishers) and dates as YYYY-MM-DD.");
        parts.add("The final output should ONLY be the CSV data and nothing else (no introductory text or markdown).");
        return String.join("\n", parts);
    }
}
