package io.github.drompincen.autopilot.runtime.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.autopilot.protocol.api.SearchHit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
public class BraveSearchBackend implements SearchBackend {

    private static final String ENDPOINT = "https://api.search.brave.com/res/v1/web/search";
    // Brave caps page size at 20
    private static final int MAX_COUNT = 20;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    private final String apiKey;

    public BraveSearchBackend(@Value("${autopilot.search.brave.api-key:}") String apiKey) {
        this.apiKey = apiKey;
    }

    @Override public String engine() { return "brave"; }

    @Override public boolean isConfigured() { return apiKey != null && !apiKey.isBlank(); }

    @Override
    public List<SearchHit> search(String query, int maxResults) throws IOException, InterruptedException {
        int count = Math.min(maxResults, MAX_COUNT);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(ENDPOINT + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                        + "&count=" + count))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .header("X-Subscription-Token", apiKey)
                .GET()
                .build();
        HttpResponse<String> response = CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("Brave Search returned HTTP " + response.statusCode());
        }
        return parseResults(response.body(), maxResults);
    }

    static List<SearchHit> parseResults(String body, int maxResults) throws IOException {
        JsonNode results = MAPPER.readTree(body).path("web").path("results");
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode r : results) {
            if (hits.size() >= maxResults) break;
            hits.add(new SearchHit(r.path("title").asText(""), r.path("url").asText(""),
                    r.path("description").asText("")));
        }
        return hits;
    }
}
