package com.overlaychat.server.avatar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Profile lookup against the Bilibili space API ({@code GET <baseUrl>?mid=<uid>}).
 */
public class BilibiliProfileClient implements ProfileClient {

    private final String baseUrl;   // e.g. https://api.bilibili.com/x/space/acc/info
    private final Duration timeout;

    private final ObjectMapper mapper;
    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    public BilibiliProfileClient(String baseUrl, Duration timeout, ObjectMapper mapper) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public String fetchFaceUrl(long userId) throws ProfileRejectedException, IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "?mid=" + userId))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString());
        int code = res.statusCode();
        if (code < 200 || code >= 300) {
            throw new ProfileRejectedException(code);
        }

        JsonNode face = mapper.readTree(res.body()).path("data").path("face");
        if (!face.isTextual() || face.asText().isEmpty()) {
            throw new IOException("no face url in profile response for uid=" + userId);
        }
        return face.asText();
    }
}
