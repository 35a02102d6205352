package com.raceresults.crawler.service;

import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.MergeSummary;
import com.raceresults.crawler.model.ResultRecord;
import com.raceresults.crawler.model.StagedResultSet;
import com.raceresults.crawler.output.MasterDatasetException;
import com.raceresults.crawler.output.MasterDatasetFile;
import com.raceresults.crawler.output.StagingArea;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StagingMergeEngineTest {

    private static final String STAGED_HEADER = "Name,Category,RaceName,Event,Location,Rank,Date,SourceUrl\n";

    @TempDir
    Path tempDir;

    private CrawlerProperties properties;
    private Path stagingDir;
    private Path masterPath;
    private MasterDatasetFile masterFile;
    private StagingMergeEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        properties = new CrawlerProperties();
        stagingDir = tempDir.resolve("staging");
        masterPath = tempDir.resolve("ski-data.csv");
        properties.getData().setStagingDir(stagingDir.toString());
        properties.getData().setQuarantineDir(tempDir.resolve("rejected").toString());
        properties.getData().setMasterFile(masterPath.toString());
        Files.createDirectories(stagingDir);
        masterFile = new MasterDatasetFile(properties);
        engine = new StagingMergeEngine(new StagingArea(properties), masterFile, properties);
    }

    @Test
    void laterStagedFileWinsOnSameKey() throws Exception {
        // name order is the reverse of modification order
        Path older = stage("z-older.csv", "Jane Doe,U14,SlalomCup,Slalom,Davos,5,2025-02-01,https://x.test/a.pdf\n");
        Path newer = stage("a-newer.csv", "Jane Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01,https://x.test/b.pdf\n");
        Files.setLastModifiedTime(older, FileTime.from(Instant.parse("2025-06-01T00:00:00Z")));
        Files.setLastModifiedTime(newer, FileTime.from(Instant.parse("2025-06-01T00:05:00Z")));

        MergeSummary summary = engine.merge();

        List<ResultRecord> master = masterFile.read();
        assertThat(master).hasSize(1);
        assertThat(master.get(0).getRank()).isEqualTo("3");
        assertThat(summary.duplicatesCollapsed()).isEqualTo(1);
        assertThat(summary.stagedFilesMerged()).isEqualTo(2);
        assertThat(summary.masterRowsAfter()).isEqualTo(1);
        assertThat(Files.exists(older)).isFalse();
        assertThat(Files.exists(newer)).isFalse();
    }

    @Test
    void stagedRowReplacesMasterRowAndOthersSurvive() throws Exception {
        Files.writeString(masterPath, STAGED_HEADER
                + "Jane Doe,U14,SlalomCup,Slalom,Davos,7,2025-02-01,\n"
                + "Tom Roe,U16,SlalomCup,Slalom,Davos,2,2025-02-01,\n");
        stage("kwo2025-1.csv", "Jane Doe,U14,SlalomCup,Slalom,Davos,4,2025-02-01,https://x.test/1.pdf\n");

        MergeSummary summary = engine.merge();

        assertThat(summary.masterRowsBefore()).isEqualTo(2);
        assertThat(summary.masterRowsAfter()).isEqualTo(2);
        assertThat(masterFile.read()).extracting(ResultRecord::getSubjectName, ResultRecord::getRank)
                .containsExactly(
                        tuple("Jane Doe", "4"),
                        tuple("Tom Roe", "2"));
    }

    @Test
    void emptyStagingLeavesMasterUntouched() throws Exception {
        Files.writeString(masterPath, STAGED_HEADER + "Zed,U14,Cup,Slalom,Davos,1,2025-01-01,\nAmy,U14,Cup,Slalom,Davos,2,2025-01-01,\n");
        byte[] before = Files.readAllBytes(masterPath);

        MergeSummary summary = engine.merge();

        assertThat(summary.stagedFilesMerged()).isZero();
        assertThat(summary.masterRowsAfter()).isEqualTo(2);
        assertThat(Files.readAllBytes(masterPath)).isEqualTo(before);
    }

    @Test
    void mergingSameContentTwiceIsIdempotent() throws Exception {
        String rows = "Jane Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01,https://x.test/1.pdf\n"
                + "Tom Roe,U16,GS Cup,Giant Slalom,Arosa,DNF,2025-01-15,https://x.test/1.pdf\n";
        stage("kwo2025-1.csv", rows);
        engine.merge();
        byte[] first = Files.readAllBytes(masterPath);

        stage("kwo2025-1.csv", rows);
        MergeSummary second = engine.merge();

        assertThat(Files.readAllBytes(masterPath)).isEqualTo(first);
        assertThat(second.duplicatesCollapsed()).isEqualTo(2);
        assertThat(second.masterRowsAfter()).isEqualTo(2);
    }

    @Test
    void unreadableFileIsLeftInStagingByDefault() throws Exception {
        Path bad = stagingDir.resolve("kwo2025-bad.csv");
        Files.writeString(bad, "Name,Rank\nJane,1\n");
        stage("kwo2025-good.csv", "Jane Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01,https://x.test/1.pdf\n");

        MergeSummary summary = engine.merge();

        assertThat(summary.stagedFilesRejected()).isEqualTo(1);
        assertThat(summary.stagedFilesMerged()).isEqualTo(1);
        assertThat(Files.exists(bad)).isTrue();
        assertThat(masterFile.read()).hasSize(1);
    }

    @Test
    void unreadableFileIsQuarantinedWhenConfigured() throws Exception {
        properties.getMerge().setRejectedFilePolicy(CrawlerProperties.Merge.RejectedFilePolicy.QUARANTINE);
        Path bad = stagingDir.resolve("kwo2025-bad.csv");
        Files.writeString(bad, "");

        MergeSummary summary = engine.merge();

        assertThat(summary.stagedFilesRejected()).isEqualTo(1);
        assertThat(Files.exists(bad)).isFalse();
        assertThat(Files.exists(tempDir.resolve("rejected/kwo2025-bad.csv"))).isTrue();
        assertThat(Files.exists(masterPath)).isFalse();
    }

    @Test
    void masterWriteFailureKeepsStagedFiles() throws Exception {
        Files.createDirectories(masterPath);
        Path staged = stage("kwo2025-1.csv", "Jane Doe,U14,SlalomCup,Slalom,Davos,3,2025-02-01,https://x.test/1.pdf\n");

        assertThatThrownBy(() -> engine.merge()).isInstanceOf(MasterDatasetException.class);
        assertThat(Files.exists(staged)).isTrue();
    }

    @Test
    void consolidatedRowsAreSortedByDateRaceAndName() {
        ResultRecord late = record("Amy", "B Cup", "2025-03-01", "1");
        ResultRecord earlyB = record("Bob", "A Cup", "2025-01-01", "2");
        ResultRecord earlyA = record("Ann", "A Cup", "2025-01-01", "3");

        StagingMergeEngine.Consolidated result = StagingMergeEngine.consolidate(
                List.of(late), List.of(new StagedResultSet("t1", Path.of("t1.csv"), List.of(earlyB, earlyA))));

        assertThat(result.records()).containsExactly(earlyA, earlyB, late);
        assertThat(result.duplicatesCollapsed()).isZero();
    }

    @Test
    void equalSortKeysKeepEncounterOrder() {
        ResultRecord slalom = record("Ann", "A Cup", "2025-01-01", "1").toBuilder().discipline("Slalom").build();
        ResultRecord gs = record("Ann", "A Cup", "2025-01-01", "2").toBuilder().discipline("Giant Slalom").build();

        StagingMergeEngine.Consolidated result = StagingMergeEngine.consolidate(
                List.of(), List.of(new StagedResultSet("t1", Path.of("t1.csv"), List.of(slalom, gs))));

        assertThat(result.records()).containsExactly(slalom, gs);
    }

    @Test
    void disjointStagedSetsGiveSameMasterInAnyOrder() {
        StagedResultSet first = new StagedResultSet("t1", Path.of("t1.csv"),
                List.of(record("Ann", "A Cup", "2025-01-01", "1")));
        StagedResultSet second = new StagedResultSet("t2", Path.of("t2.csv"),
                List.of(record("Bob", "B Cup", "2025-02-01", "4")));

        assertThat(StagingMergeEngine.consolidate(List.of(), List.of(first, second)).records())
                .isEqualTo(StagingMergeEngine.consolidate(List.of(), List.of(second, first)).records());
    }

    @Test
    void secondMergeIsRefusedWhileOneIsActive() throws Exception {
        StagingArea blockingArea = mock(StagingArea.class);
        CountDownLatch listing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(blockingArea.listStagedFiles()).thenAnswer(invocation -> {
            listing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        StagingMergeEngine blocked = new StagingMergeEngine(blockingArea, masterFile, properties);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<MergeSummary> first = executor.submit(blocked::merge);
            assertThat(listing.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(blocked.isMerging()).isTrue();
            assertThatThrownBy(blocked::merge).isInstanceOf(ActiveRunException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).stagedFilesMerged()).isZero();
            assertThat(blocked.isMerging()).isFalse();
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private Path stage(String name, String rows) throws Exception {
        Path file = stagingDir.resolve(name);
        Files.writeString(file, STAGED_HEADER + rows);
        return file;
    }

    private static ResultRecord record(String name, String race, String date, String rank) {
        return ResultRecord.builder()
                .subjectName(name).category("U14").eventName(race).discipline("Slalom")
                .location("Davos").rank(rank).date(date).sourceLocator("")
                .build();
    }
}
