package com.raceresults.crawler.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.raceresults.crawler.model.ResultRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column layout shared by extraction output, staged files and the master dataset.
 *
 * Extraction output:  Name,Category,RaceName,Event,Location,Rank,Date
 * Staged / master:    the same plus SourceUrl (provenance)
 *
 * Reading maps columns by header name, case-insensitively, so files written by older
 * versions without Location or SourceUrl still load. Name, RaceName and Event are required.
 */
public final class ResultCsvFormat {

    public static final String NAME = "Name";
    public static final String CATEGORY = "Category";
    public static final String RACE_NAME = "RaceName";
    public static final String EVENT = "Event";
    public static final String LOCATION = "Location";
    public static final String RANK = "Rank";
    public static final String DATE = "Date";
    public static final String SOURCE_URL = "SourceUrl";

    public static final String[] EXTRACTION_HEADERS = {
            NAME, CATEGORY, RACE_NAME, EVENT, LOCATION, RANK, DATE
    };

    public static final String[] MASTER_HEADERS = {
            NAME, CATEGORY, RACE_NAME, EVENT, LOCATION, RANK, DATE, SOURCE_URL
    };

    private static final List<String> KEY_COLUMNS = List.of(NAME, RACE_NAME, EVENT);

    private ResultCsvFormat() {
    }

    public static CSVWriter newWriter(Writer writer) {
        return new CSVWriter(writer,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
    }

    /**
     * Returns the key columns missing from a header row, empty when the header is usable.
     */
    public static List<String> missingKeyColumns(String[] header) {
        Map<String, Integer> index = indexHeader(header);
        return KEY_COLUMNS.stream()
                .filter(col -> !index.containsKey(col.toLowerCase(Locale.ROOT)))
                .toList();
    }

    /**
     * Parses a result CSV with a header row.
     *
     * @throws IllegalArgumentException when the file is empty or lacks key columns
     */
    public static List<ResultRecord> read(Reader source) throws IOException, CsvException {
        List<String[]> rows;
        try (CSVReader reader = new CSVReader(source)) {
            rows = reader.readAll();
        }
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("no header row");
        }

        String[] header = rows.get(0);
        List<String> missing = missingKeyColumns(header);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("missing columns " + missing + " in header " + Arrays.toString(header));
        }
        Map<String, Integer> index = indexHeader(header);

        List<ResultRecord> records = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            String[] cols = rows.get(i);
            if (isBlankRow(cols)) continue;
            records.add(ResultRecord.builder()
                    .subjectName(cell(cols, index, NAME))
                    .category(cell(cols, index, CATEGORY))
                    .eventName(cell(cols, index, RACE_NAME))
                    .discipline(cell(cols, index, EVENT))
                    .location(cell(cols, index, LOCATION))
                    .rank(cell(cols, index, RANK))
                    .date(cell(cols, index, DATE))
                    .sourceLocator(cell(cols, index, SOURCE_URL))
                    .build());
        }
        return records;
    }

    public static void write(Writer target, List<ResultRecord> records) throws IOException {
        try (CSVWriter writer = newWriter(target)) {
            writer.writeNext(MASTER_HEADERS);
            for (ResultRecord r : records) {
                writer.writeNext(toRow(r));
            }
        }
    }

    public static String[] toRow(ResultRecord r) {
        return new String[]{
                str(r.getSubjectName()),
                str(r.getCategory()),
                str(r.getEventName()),
                str(r.getDiscipline()),
                str(r.getLocation()),
                str(r.getRank()),
                str(r.getDate()),
                str(r.getSourceLocator())
        };
    }

    static boolean isBlankRow(String[] cols) {
        return Arrays.stream(cols).allMatch(c -> c == null || c.isBlank());
    }

    private static Map<String, Integer> indexHeader(String[] header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim();
            index.putIfAbsent(name.toLowerCase(Locale.ROOT), i);
        }
        return index;
    }

    private static String cell(String[] cols, Map<String, Integer> index, String column) {
        Integer idx = index.get(column.toLowerCase(Locale.ROOT));
        if (idx == null || idx >= cols.length || cols[idx] == null) return "";
        return cols[idx].trim();
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
