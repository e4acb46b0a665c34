package io.github.drompincen.autopilot.executors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.autopilot.protocol.api.ActionTypes;
import io.github.drompincen.autopilot.protocol.api.SearchHit;
import io.github.drompincen.autopilot.protocol.api.WebSearchActionConfig;
import io.github.drompincen.autopilot.runtime.executor.*;
import io.github.drompincen.autopilot.runtime.search.SearchBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.*;

/**
 * Runs a web search through the configured engine and optionally files a digest of the
 * hits as a memory entry.
 */
@Component
public class WebSearchExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(WebSearchExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    static final int DIGEST_HITS = 5;

    private final Map<String, SearchBackend> backends = new LinkedHashMap<>();
    private final ActionFollowUp followUp;
    private final String defaultEngine;

    public WebSearchExecutor(List<SearchBackend> backends,
                             ActionFollowUp followUp,
                             @Value("${autopilot.search.default-engine:searxng}") String defaultEngine) {
        backends.forEach(b -> this.backends.put(b.engine(), b));
        this.followUp = followUp;
        this.defaultEngine = defaultEngine;
    }

    @Override public String actionType() { return ActionTypes.WEB_SEARCH; }

    @Override
    public ExecutionResult execute(Map<String, Object> config, ExecutionContext ctx) {
        WebSearchActionConfig cfg = ExecutorConfigs.read(config, WebSearchActionConfig.class);
        try {
            ExecutionResult result = search(cfg, ctx);
            if (cfg.notifyOwner()) {
                followUp.notifyCompleted(ctx, "success");
            }
            return result;
        } catch (ExecutionFailedException e) {
            if (cfg.notifyOwner()) {
                followUp.notifyCompleted(ctx, "error");
            }
            throw e;
        }
    }

    private ExecutionResult search(WebSearchActionConfig cfg, ExecutionContext ctx) {
        if (cfg.query() == null || cfg.query().isBlank()) {
            throw new ExecutionFailedException("No query provided");
        }
        String engine = cfg.engine() != null && !cfg.engine().isBlank() ? cfg.engine() : defaultEngine;
        SearchBackend backend = backends.get(engine);
        if (backend == null) {
            throw new ExecutionFailedException("Unsupported search engine: " + engine
                    + ". Supported: " + backends.keySet());
        }
        if (!backend.isConfigured()) {
            throw new ExecutionFailedException("Search engine '" + engine + "' is not configured");
        }

        List<SearchHit> hits;
        try {
            hits = backend.search(cfg.query(), cfg.maxResultsOrDefault());
        } catch (IOException e) {
            throw new ExecutionFailedException("Search failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException("Search interrupted", e);
        }
        log.info("Web search '{}' via {} returned {} results (action={})",
                cfg.query(), engine, hits.size(), ctx.actionId());

        if (cfg.saveToMemory() && !hits.isEmpty()) {
            followUp.remember(ctx, digest(cfg.query(), hits), "scheduled-search");
        }
        ObjectNode output = MAPPER.createObjectNode();
        output.put("status", "success");
        output.put("query", cfg.query());
        output.put("engine", engine);
        output.put("results_count", hits.size());
        ArrayNode results = output.putArray("results");
        hits.forEach(hit -> results.add(MAPPER.valueToTree(hit)));
        return ExecutionResult.of(output);
    }

    static String digest(String query, List<SearchHit> hits) {
        StringBuilder sb = new StringBuilder("Search results for '").append(query).append("':\n");
        hits.stream().limit(DIGEST_HITS).forEach(hit ->
                sb.append("- ").append(hit.title()).append(": ").append(hit.snippet()).append('\n'));
        return sb.toString();
    }
}
