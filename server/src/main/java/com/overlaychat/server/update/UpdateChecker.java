package com.overlaychat.server.update;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the release registry for the latest release once the server is up and logs a notice
 * when it differs from the running version. Informational only.
 */
@Component
public class UpdateChecker {
    private static final Logger log = LoggerFactory.getLogger(UpdateChecker.class);

    private final ObjectMapper mapper;
    private final boolean enabled;
    private final String releaseUrl;
    private final String currentVersion;

    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    public UpdateChecker(ObjectMapper mapper,
                         @Value("${overlay.update-check.enabled:true}") boolean enabled,
                         @Value("${overlay.update-check.url:https://api.github.com/repos/xfgryujk/blivechat/releases/latest}") String releaseUrl,
                         @Value("${overlay.version:v1.1.4}") String currentVersion) {
        this.mapper = mapper;
        this.enabled = enabled;
        this.releaseUrl = releaseUrl;
        this.currentVersion = currentVersion;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!enabled) return;
        check();
    }

    /**
     * Fires the request and returns without waiting. The future completes with the notice, if any;
     * failures are logged at debug and complete it empty.
     */
    public CompletableFuture<Optional<String>> check() {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(releaseUrl))
                .timeout(Duration.ofSeconds(15))
                .header("Accept", "application/vnd.github+json")
                .GET()
                .build();

        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .thenApply(res -> {
                    if (res.statusCode() != 200) {
                        log.debug("[UPDATE] release check status={}", res.statusCode());
                        return Optional.<String>empty();
                    }
                    try {
                        return newerRelease(mapper.readTree(res.body()));
                    } catch (Exception e) {
                        log.debug("[UPDATE] unreadable release info: {}", e.getMessage());
                        return Optional.<String>empty();
                    }
                })
                .exceptionally(e -> {
                    log.debug("[UPDATE] release check failed: {}", e.toString());
                    return Optional.empty();
                })
                .whenComplete((notice, e) -> notice.ifPresent(log::info));
    }

    Optional<String> newerRelease(JsonNode release) {
        String name = release.path("name").asText("");
        if (name.isEmpty() || name.equals(currentVersion)) {
            return Optional.empty();
        }
        return Optional.of("New version available: " + name
                + System.lineSeparator() + release.path("body").asText("")
                + System.lineSeparator() + "Download: " + release.path("html_url").asText(""));
    }
}
