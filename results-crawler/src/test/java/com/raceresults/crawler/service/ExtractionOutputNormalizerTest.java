package com.raceresults.crawler.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionOutputNormalizerTest {

    private static final String HEADER = "Name,Category,RaceName,Event,Location,Rank,Date";
    private static final String ROW = "Jane Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01";

    private final ExtractionOutputNormalizer normalizer = new ExtractionOutputNormalizer();

    @ParameterizedTest
    @ValueSource(strings = {
            "```csv\n" + HEADER + "\n" + ROW + "\n```",
            "```\n" + HEADER + "\n" + ROW + "\n```\n",
            "  ```CSV  \n" + HEADER + "\n" + ROW + "\n```   ",
            "~~~text\n" + HEADER + "\n" + ROW + "\n~~~",
            "````csv\n" + HEADER + "\n" + ROW + "\n````",
            "```csv\n" + HEADER + "\n" + ROW + "```",
            HEADER + "\n" + ROW
    })
    void stripsEnumeratedFenceForms(String raw) {
        assertThat(normalizer.normalize(raw)).containsExactly(HEADER, ROW);
    }

    @Test
    void trimsLinesAndDropsBlankOnes() {
        String raw = "\n\n   " + HEADER + "   \r\n\r\n\t" + ROW + "\n   \n";

        assertThat(normalizer.normalize(raw)).containsExactly(HEADER, ROW);
    }

    @Test
    void leavesBackticksInsideDataAlone() {
        String raw = HEADER + "\nJane `JD` Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01";

        assertThat(normalizer.normalize(raw)).hasSize(2);
        assertThat(normalizer.normalize(raw).get(1)).startsWith("Jane `JD` Doe");
    }

    @Test
    void headerOnlyIsAnEmptyTable() {
        ExtractionOutputNormalizer.ExtractedTable table = normalizer.parse("```csv\n" + HEADER + "\n```");

        assertThat(table.isEmpty()).isTrue();
        assertThat(table.header()).containsExactly("Name", "Category", "RaceName", "Event", "Location", "Rank", "Date");
    }

    @Test
    void parsesQuotedCells() {
        ExtractionOutputNormalizer.ExtractedTable table = normalizer.parse(
                HEADER + "\n\"Doe, Jane\",U14,\"Cup, Final\",Slalom,Davos,DNF,2025-02-01");

        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0)[0]).isEqualTo("Doe, Jane");
        assertThat(table.rows().get(0)[5]).isEqualTo("DNF");
    }

    @Test
    void emptyOutputIsAnExtractionError() {
        assertThatThrownBy(() -> normalizer.parse("```csv\n```"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> normalizer.parse("   "))
                .isInstanceOf(ExtractionException.class);
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @Test
    void proseInsteadOfCsvIsAnExtractionError() {
        assertThatThrownBy(() -> normalizer.parse("I could not find any results for these clubs."))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("header lacks");
    }
}
