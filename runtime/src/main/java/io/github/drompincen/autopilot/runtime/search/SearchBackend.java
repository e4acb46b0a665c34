package io.github.drompincen.autopilot.runtime.search;

import io.github.drompincen.autopilot.protocol.api.SearchHit;

import java.io.IOException;
import java.util.List;

public interface SearchBackend {

    /** Engine identifier used in web_search configs, e.g. {@code searxng}. */
    String engine();

    /** False when required settings (URL, API key) are missing. */
    boolean isConfigured();

    List<SearchHit> search(String query, int maxResults) throws IOException, InterruptedException;
}
