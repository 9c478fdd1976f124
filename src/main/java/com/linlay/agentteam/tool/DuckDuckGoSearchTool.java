package com.linlay.agentteam.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Web search through the DuckDuckGo instant answer API.
 */
public class DuckDuckGoSearchTool implements BaseTool {

    public static final String OPTION_SEARCH = "search";
    public static final String OPTION_MAX_RESULTS = "fixed_max_results";

    static final Map<String, Object> DEFAULT_OPTIONS = Map.of(
            OPTION_SEARCH, true,
            OPTION_MAX_RESULTS, 5
    );

    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoSearchTool.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final boolean searchEnabled;
    private final int maxResults;

    public DuckDuckGoSearchTool(WebClient webClient, ObjectMapper objectMapper, Map<String, Object> options) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.searchEnabled = ToolOptions.flag(options, OPTION_SEARCH, true);
        this.maxResults = ToolOptions.positiveInt(options, OPTION_MAX_RESULTS, 5);
    }

    @Override
    public String name() {
        return "duckduckgo_search";
    }

    @Override
    public String description() {
        return "Search the web with DuckDuckGo and return up to " + maxResults + " results.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of("query", Map.of("type", "string", "description", "Search query")),
                "required", List.of("query")
        );
    }

    public int maxResults() {
        return maxResults;
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("tool", name());
        if (!searchEnabled) {
            root.put("error", "search is disabled for this tool");
            return root;
        }
        String query = ToolOptions.text(args, "query");
        if (query == null) {
            root.put("error", "query is required");
            return root;
        }
        root.put("query", query);
        try {
            JsonNode body = webClient.get()
                    .uri(builder -> builder
                            .scheme("https")
                            .host("api.duckduckgo.com")
                            .path("/")
                            .queryParam("q", query)
                            .queryParam("format", "json")
                            .queryParam("no_html", "1")
                            .queryParam("skip_disambig", "1")
                            .build())
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(REQUEST_TIMEOUT);
            ArrayNode results = root.putArray("results");
            if (body != null) {
                if (body.hasNonNull("AbstractText") && !body.get("AbstractText").asText().isBlank()) {
                    ObjectNode item = results.addObject();
                    item.set("text", body.get("AbstractText"));
                    item.set("url", body.path("AbstractURL"));
                }
                collectTopics(body.path("RelatedTopics"), results);
            }
            return root;
        } catch (RuntimeException ex) {
            log.warn("duckduckgo search failed for query '{}'", query, ex);
            root.put("error", "search failed: " + ex.getMessage());
            return root;
        }
    }

    private void collectTopics(JsonNode topics, ArrayNode results) {
        for (JsonNode topic : topics) {
            if (results.size() >= maxResults) {
                return;
            }
            if (topic.has("Topics")) {
                collectTopics(topic.get("Topics"), results);
                continue;
            }
            if (!topic.hasNonNull("Text")) {
                continue;
            }
            ObjectNode item = results.addObject();
            item.set("text", topic.get("Text"));
            item.set("url", topic.path("FirstURL"));
        }
    }
}
