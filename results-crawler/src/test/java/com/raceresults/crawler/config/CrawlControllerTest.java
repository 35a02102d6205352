package com.raceresults.crawler.config;

import com.raceresults.crawler.model.CrawlTarget;
import com.raceresults.crawler.model.TargetStatus;
import com.raceresults.crawler.service.CrawlRunService;
import com.raceresults.crawler.service.CrawlScheduler;
import com.raceresults.crawler.service.StagingMergeEngine;
import com.raceresults.crawler.service.TargetStore;
import com.raceresults.crawler.service.TargetStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CrawlController.class)
class CrawlControllerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-06-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CrawlRunService crawlRunService;

    @MockBean
    private StagingMergeEngine mergeEngine;

    @MockBean
    private TargetStore targetStore;

    @MockBean
    private CrawlScheduler scheduler;

    @MockBean
    private CrawlerProperties properties;

    @MockBean
    private Clock clock;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(Instant.parse("2025-06-01T00:00:00Z"));
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
    }

    @Test
    void runIsAcceptedAndStartedInBackground() throws Exception {
        mockMvc.perform(post("/crawl/run"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.action").value("run"));

        verify(crawlRunService, timeout(2000)).runAndMerge();
    }

    @Test
    void runIsRejectedWhileAnotherIsActive() throws Exception {
        when(crawlRunService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/crawl/run"))
                .andExpect(status().isConflict());
    }

    @Test
    void mergeIsRejectedWhileAnotherIsActive() throws Exception {
        when(mergeEngine.isMerging()).thenReturn(true);

        mockMvc.perform(post("/crawl/merge"))
                .andExpect(status().isConflict());

        verify(mergeEngine, never()).merge();
    }

    @Test
    void mergeIsAcceptedWhenIdle() throws Exception {
        mockMvc.perform(post("/crawl/merge"))
                .andExpect(status().isAccepted());

        verify(mergeEngine, timeout(2000)).merge();
    }

    @Test
    void generationIsRejectedDuringARun() throws Exception {
        when(crawlRunService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/crawl/targets/generate"))
                .andExpect(status().isConflict());

        verify(crawlRunService, never()).generateTargets();
    }

    @Test
    void stopIsForwarded() throws Exception {
        mockMvc.perform(post("/crawl/stop")).andExpect(status().isAccepted());

        verify(crawlRunService).requestStop();
    }

    @Test
    void listsTargetsWithEligibility() throws Exception {
        CrawlTarget target = CrawlTarget.builder()
                .id("kwo2025-1396")
                .locator("https://www.swiss-ski-kwo.ch/tk/ranglisten/2025/1396.pdf")
                .status(TargetStatus.FAILED)
                .tracking(new CrawlTarget.Tracking(NOW, NOW, 2, NOW, null))
                .build();
        when(targetStore.load()).thenReturn(List.of(target));
        when(scheduler.isEligible(any(), any())).thenReturn(true);

        mockMvc.perform(get("/crawl/targets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("kwo2025-1396"))
                .andExpect(jsonPath("$[0].status").value("failed"))
                .andExpect(jsonPath("$[0].eligible").value(true))
                .andExpect(jsonPath("$[0].attemptCount").value(2));
    }

    @Test
    void targetWithoutTrackingOrStatusIsListed() throws Exception {
        CrawlTarget target = CrawlTarget.builder()
                .id("kwo2025-1397")
                .locator("https://www.swiss-ski-kwo.ch/tk/ranglisten/2025/1397.pdf")
                .status(null)
                .tracking(null)
                .build();
        when(targetStore.load()).thenReturn(List.of(target));

        mockMvc.perform(get("/crawl/targets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("kwo2025-1397"))
                .andExpect(jsonPath("$[0].eligible").value(false))
                .andExpect(jsonPath("$[0].attemptCount").value(0));
    }

    @Test
    void unreadableTargetListIsAServerError() throws Exception {
        when(targetStore.load()).thenThrow(new TargetStoreException("Target list not found: x.json", null));

        mockMvc.perform(get("/crawl/targets"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Target list not found: x.json"));
    }
}
