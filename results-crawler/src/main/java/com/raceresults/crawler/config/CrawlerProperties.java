package com.raceresults.crawler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "crawler")
@Data
public class CrawlerProperties {

    private DataFiles data = new DataFiles();
    private Fetch fetch = new Fetch();
    private Extraction extraction = new Extraction();
    private Run run = new Run();
    private Merge merge = new Merge();
    private Scheduling scheduling = new Scheduling();
    private Generator generator = new Generator();

    @Data
    public static class DataFiles {
        private String targetsFile = "data/crawl_targets.json";
        private String monitoringFile = "data/monitoring_targets.json";
        private String stagingDir = "data/staging";
        /** Dry-run output lands here and is never merged. */
        private String dryRunStagingDir = "data/staging-dry-run";
        private String quarantineDir = "data/staging-rejected";
        private String masterFile = "data/ski-data.csv";
    }

    @Data
    public static class Fetch {
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 60;
        private String userAgent = "race-results-crawler/1.0";
    }

    @Data
    public static class Extraction {
        private ExtractionMode mode = ExtractionMode.DRY_RUN;
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String model = "gemini-1.5-flash";
        private String apiKey;
        private String documentMimeType = "application/pdf";
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 180;

        public boolean isDryRun() {
            return mode == ExtractionMode.DRY_RUN;
        }

        public enum ExtractionMode {
            DRY_RUN, GEMINI
        }
    }

    @Data
    public static class Run {
        private DuplicateDocumentPolicy duplicateDocumentPolicy = DuplicateDocumentPolicy.MARK_PROCESSED;

        /** Dry runs stage output but never save the target list. */
        private boolean saveTargetsOnDryRun = false;

        public enum DuplicateDocumentPolicy {
            MARK_PROCESSED, LEAVE_PENDING
        }
    }

    @Data
    public static class Merge {
        private boolean mergeAfterCrawl = true;
        private RejectedFilePolicy rejectedFilePolicy = RejectedFilePolicy.LEAVE;

        public enum RejectedFilePolicy {
            LEAVE, QUARANTINE
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Generator {
        private String calendarCsv = "data/kwo_terminkalender_2025.csv";
        private char delimiter = ';';
        private String idColumn = "V-Nr";
        private String dateColumn = "Datum";
        private String idPrefix = "kwo2025-";
        private String urlTemplate = "https://www.swiss-ski-kwo.ch/tk/ranglisten/2025/{id}.pdf";
        private int windowYears = 1;
    }
}
