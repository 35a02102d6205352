package com.raceresults.crawler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raceresults.crawler.config.CrawlerProperties;
import com.raceresults.crawler.model.MonitoringCriteria;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Base64;

/**
 * Calls the Gemini generateContent REST endpoint with the document attached inline.
 *
 * POST {baseUrl}/v1beta/models/{model}:generateContent
 *
 * The API key comes from crawler.extraction.api-key (GEMINI_API_KEY). Without a key every
 * call fails, which marks the target Failed rather than stopping the run.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "crawler.extraction.mode", havingValue = "GEMINI")
public class GeminiExtractionService implements ExtractionService {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ExtractionPromptBuilder promptBuilder;
    private final CrawlerProperties.Extraction config;

    public GeminiExtractionService(@Qualifier("extractionRestTemplate") RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   ExtractionPromptBuilder promptBuilder,
                                   CrawlerProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.promptBuilder = promptBuilder;
        this.config = properties.getExtraction();
        if (!hasApiKey()) {
            log.warn("GEMINI_API_KEY not set - extraction calls will fail");
        }
    }

    @Override
    public String extract(byte[] document, MonitoringCriteria criteria) {
        if (!hasApiKey()) {
            throw new ExtractionException("Gemini API key is not configured");
        }

        String url = config.getBaseUrl() + "/v1beta/models/" + config.getModel() + ":generateContent";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", config.getApiKey());

        String body = requestBody(document, promptBuilder.build(criteria));
        log.info("Sending {} kB document to {}", document.length / 1024, config.getModel());

        String response;
        try {
            response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new ExtractionException("Gemini call failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ExtractionException("Gemini returned an empty response body");
        }
        return responseText(response);
    }

    String requestBody(byte[] document, String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode parts = root.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", prompt);
        parts.addObject().putObject("inline_data")
                .put("mime_type", config.getDocumentMimeType())
                .put("data", Base64.getEncoder().encodeToString(document));
        return root.toString();
    }

    String responseText(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ExtractionException("Gemini response is not JSON: " + e.getMessage(), e);
        }

        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new ExtractionException("Gemini returned no result: " + blockReason);
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        if (text.toString().isBlank()) {
            throw new ExtractionException("Gemini returned empty text (finishReason="
                    + candidate.path("finishReason").asText("unknown") + ")");
        }
        return text.toString();
    }

    private boolean hasApiKey() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }
}
