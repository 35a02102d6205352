package com.raceresults.crawler.service;

import com.raceresults.crawler.config.CrawlerProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Downloads a result document (usually a PDF ranking list) by its locator.
 *
 * Every request is bounded by the configured timeout. Transport errors, 429 and 5xx are
 * retried a few times by Resilience4j (see RetryableFetchPredicate); anything else
 * fails straight away.
 */
@Service
@Slf4j
public class DocumentFetcher {

    private final CrawlerProperties properties;
    private final HttpClient httpClient;

    public DocumentFetcher(CrawlerProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getFetch().getConnectTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Retry(name = "documentSource")
    public byte[] fetch(String locator) {
        URI uri;
        try {
            uri = URI.create(locator);
        } catch (IllegalArgumentException e) {
            throw new InvalidTargetException("Malformed locator: " + locator);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(properties.getFetch().getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getFetch().getUserAgent())
                .GET()
                .build();

        log.info("Downloading document from {}", locator);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new DocumentFetchException("Download failed for " + locator + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentFetchException("Download interrupted for " + locator, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DocumentFetchException("Download failed for " + locator + " - HTTP " + status, status);
        }

        byte[] body = response.body();
        log.info("Downloaded {} kB from {}", Math.round(body.length / 102.4) / 10.0, locator);
        return body;
    }
}
