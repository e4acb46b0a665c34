package io.github.drompincen.autopilot.runtime.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.autopilot.protocol.api.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

/**
 * Queries a SearXNG instance through its JSON output format.
 */
@Component
public class SearxngSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(SearxngSearchBackend.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final HttpClient CLIENT = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    private final String queryUrl;

    public SearxngSearchBackend(@Value("${autopilot.search.searxng.query-url:}") String queryUrl) {
        this.queryUrl = queryUrl;
    }

    @Override public String engine() { return "searxng"; }

    @Override public boolean isConfigured() { return queryUrl != null && !queryUrl.isBlank(); }

    @Override
    public List<SearchHit> search(String query, int maxResults) throws IOException, InterruptedException {
        String separator = queryUrl.contains("?") ? "&" : "?";
        String url = queryUrl + separator + "q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&format=json&pageno=1";
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response = CLIENT.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new IOException("SearXNG returned HTTP " + response.statusCode());
        }
        List<SearchHit> hits = parseResults(response.body(), maxResults);
        log.debug("SearXNG returned {} hits for \"{}\"", hits.size(), query);
        return hits;
    }

    static List<SearchHit> parseResults(String body, int maxResults) throws IOException {
        JsonNode results = MAPPER.readTree(body).path("results");
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode r : results) {
            if (hits.size() >= maxResults) break;
            hits.add(new SearchHit(r.path("title").asText(""), r.path("url").asText(""),
                    r.path("content").asText("")));
        }
        return hits;
    }
}
