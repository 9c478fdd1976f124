package com.linlay.agentteam.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Market data lookups against the public Yahoo Finance endpoints. Each capability can be
 * switched off through the tool options.
 */
public class YFinanceTool implements BaseTool {

    public static final String OPTION_STOCK_PRICE = "stock_price";
    public static final String OPTION_ANALYST_RECOMMENDATIONS = "analyst_recommendations";
    public static final String OPTION_COMPANY_INFO = "company_info";
    public static final String OPTION_COMPANY_NEWS = "company_news";

    static final Map<String, Object> DEFAULT_OPTIONS = Map.of(
            OPTION_STOCK_PRICE, true,
            OPTION_ANALYST_RECOMMENDATIONS, true,
            OPTION_COMPANY_INFO, true,
            OPTION_COMPANY_NEWS, true
    );

    private static final Logger log = LoggerFactory.getLogger(YFinanceTool.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final int NEWS_COUNT = 5;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final List<String> enabledActions;

    public YFinanceTool(WebClient webClient, ObjectMapper objectMapper, Map<String, Object> options) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        List<String> actions = new ArrayList<>();
        for (String action : List.of(OPTION_STOCK_PRICE, OPTION_COMPANY_INFO, OPTION_ANALYST_RECOMMENDATIONS, OPTION_COMPANY_NEWS)) {
            if (ToolOptions.flag(options, action, false)) {
                actions.add(action);
            }
        }
        this.enabledActions = List.copyOf(actions);
    }

    @Override
    public String name() {
        return "yfinance";
    }

    @Override
    public String description() {
        return "Look up market data for a ticker symbol. Available actions: " + String.join(", ", enabledActions);
    }

    @Override
    public Map<String, Object> parametersSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("symbol", Map.of("type", "string", "description", "Ticker symbol, e.g. AAPL"));
        properties.put("action", Map.of("type", "string", "enum", enabledActions));
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", List.of("symbol", "action")
        );
    }

    public List<String> enabledActions() {
        return enabledActions;
    }

    @Override
    public JsonNode invoke(Map<String, Object> args) {
        String symbol = ToolOptions.text(args, "symbol");
        String action = ToolOptions.text(args, "action");
        if (symbol == null) {
            return error("symbol is required");
        }
        String normalizedAction = action == null ? OPTION_STOCK_PRICE : action.toLowerCase(Locale.ROOT);
        if (!enabledActions.contains(normalizedAction)) {
            return error("action '" + normalizedAction + "' is not enabled for this tool");
        }
        String ticker = symbol.toUpperCase(Locale.ROOT);
        try {
            return switch (normalizedAction) {
                case OPTION_STOCK_PRICE -> stockPrice(ticker);
                case OPTION_COMPANY_INFO -> companyInfo(ticker);
                case OPTION_ANALYST_RECOMMENDATIONS -> recommendations(ticker);
                case OPTION_COMPANY_NEWS -> news(ticker);
                default -> error("unknown action " + normalizedAction);
            };
        } catch (RuntimeException ex) {
            log.warn("yfinance {} lookup failed for {}", normalizedAction, ticker, ex);
            return error("lookup failed: " + ex.getMessage());
        }
    }

    private JsonNode stockPrice(String ticker) {
        JsonNode meta = chartMeta(ticker);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("symbol", ticker);
        root.set("price", meta.path("regularMarketPrice"));
        root.set("currency", meta.path("currency"));
        root.set("previousClose", meta.path("chartPreviousClose"));
        return root;
    }

    private JsonNode companyInfo(String ticker) {
        JsonNode meta = chartMeta(ticker);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("symbol", ticker);
        root.set("name", meta.has("longName") ? meta.get("longName") : meta.path("shortName"));
        root.set("exchange", meta.path("fullExchangeName"));
        root.set("instrumentType", meta.path("instrumentType"));
        root.set("currency", meta.path("currency"));
        return root;
    }

    private JsonNode recommendations(String ticker) {
        JsonNode body = get("https://query2.finance.yahoo.com/v10/finance/quoteSummary/{symbol}?modules=recommendationTrend", ticker);
        JsonNode trend = body.path("quoteSummary").path("result").path(0).path("recommendationTrend").path("trend");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("symbol", ticker);
        root.set("trend", trend.isMissingNode() ? objectMapper.createArrayNode() : trend);
        return root;
    }

    private JsonNode news(String ticker) {
        JsonNode body = get("https://query1.finance.yahoo.com/v1/finance/search?q={symbol}&quotesCount=0&newsCount=" + NEWS_COUNT, ticker);
        ArrayNode items = objectMapper.createArrayNode();
        for (JsonNode item : body.path("news")) {
            ObjectNode news = items.addObject();
            news.set("title", item.path("title"));
            news.set("publisher", item.path("publisher"));
            news.set("link", item.path("link"));
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.put("symbol", ticker);
        root.set("news", items);
        return root;
    }

    private JsonNode chartMeta(String ticker) {
        JsonNode body = get("https://query1.finance.yahoo.com/v8/finance/chart/{symbol}?interval=1d&range=1d", ticker);
        return body.path("chart").path("result").path(0).path("meta");
    }

    private JsonNode get(String uriTemplate, String ticker) {
        JsonNode body = webClient.get()
                .uri(uriTemplate, ticker)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(REQUEST_TIMEOUT);
        return body == null ? objectMapper.createObjectNode() : body;
    }

    private JsonNode error(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("tool", name());
        root.put("error", message);
        return root;
    }
}
