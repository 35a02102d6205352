package com.raceresults.crawler.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import com.raceresults.crawler.output.ResultCsvFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans raw extraction output into CSV lines.
 *
 * Recognised fence forms:
 *  - opening line: ``` or ~~~ (three or more), optionally followed by a language tag, e.g. ```csv
 *  - closing line: the fence characters alone
 *  - closing fence glued to the end of the last data line, e.g. "Jane,U14,...,2025-02-01```"
 *
 * After fence removal every line is trimmed and blank lines are dropped.
 */
@Component
public class ExtractionOutputNormalizer {

    private static final Pattern OPENING_FENCE = Pattern.compile("^(`{3,}|~{3,})\\s*[A-Za-z0-9_+.-]*\\s*$");
    private static final Pattern CLOSING_FENCE = Pattern.compile("^(`{3,}|~{3,})$");
    private static final Pattern TRAILING_FENCE = Pattern.compile("(`{3,}|~{3,})$");

    /** Header plus data rows of a normalized extraction result. */
    public record ExtractedTable(String[] header, List<String[]> rows) {

        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }

    public List<String> normalize(String raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(raw.strip().split("\\R", -1)));

        if (!lines.isEmpty() && OPENING_FENCE.matcher(lines.get(0).strip()).matches()) {
            lines.remove(0);
        }
        if (!lines.isEmpty()) {
            int last = lines.size() - 1;
            String tail = lines.get(last).strip();
            if (CLOSING_FENCE.matcher(tail).matches()) {
                lines.remove(last);
            } else {
                lines.set(last, TRAILING_FENCE.matcher(tail).replaceFirst(""));
            }
        }

        return lines.stream()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
    }

    /**
     * Normalizes and parses the output. A header without data rows is a valid, empty table.
     *
     * @throws ExtractionException when nothing is left or the header lacks the key columns
     */
    public ExtractedTable parse(String raw) {
        List<String> lines = normalize(raw);
        if (lines.isEmpty()) {
            throw new ExtractionException("Extraction output is empty");
        }

        List<String[]> rows;
        try (CSVReader reader = new CSVReader(new StringReader(String.join("\n", lines)))) {
            rows = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new ExtractionException("Extraction output is not valid CSV: " + e.getMessage(), e);
        }

        String[] header = Arrays.stream(rows.get(0)).map(String::strip).toArray(String[]::new);
        List<String> missing = ResultCsvFormat.missingKeyColumns(header);
        if (!missing.isEmpty()) {
            throw new ExtractionException("Extraction output header lacks " + missing + ": " + lines.get(0));
        }
        return new ExtractedTable(header, List.copyOf(rows.subList(1, rows.size())));
    }
}
