package com.insider.resolution.source.edgar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insider.resolution.core.model.Entity;
import com.insider.resolution.source.EntityUniverse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity universe read from the EDGAR {@code company_tickers.json} feed.
 *
 * <p>The feed is an object keyed by position ({@code {"0": {"cik_str": 320193, "ticker": "AAPL",
 * "title": "Apple Inc."}}}) and is ordered by market size, so the position becomes the size
 * rank. Issuers listed under several tickers appear once, at their best rank.</p>
 *
 * <p>The remote feed is fetched lazily on first use and kept for the lifetime of the instance.</p>
 */
public class CompanyTickersUniverse implements EntityUniverse {
    private static final Logger log = LoggerFactory.getLogger(CompanyTickersUniverse.class);

    public static final String DEFAULT_URL = "https://www.sec.gov/files/company_tickers.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String url;
    private final String userAgent;
    private final HttpClient httpClient;
    private volatile List<Entity> entities;

    private CompanyTickersUniverse(String url, String userAgent, HttpClient httpClient, List<Entity> entities) {
        this.url = url;
        this.userAgent = userAgent;
        this.httpClient = httpClient;
        this.entities = entities;
    }

    /**
     * A universe fetched from {@link #DEFAULT_URL} on first use.
     */
    public static CompanyTickersUniverse remote(String userAgent) {
        return remote(DEFAULT_URL, userAgent);
    }

    public static CompanyTickersUniverse remote(String url, String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("A descriptive User-Agent is required for EDGAR requests");
        }
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
        return new CompanyTickersUniverse(url, userAgent, client, null);
    }

    /**
     * A universe parsed from an already downloaded feed.
     */
    public static CompanyTickersUniverse fromJson(InputStream json) throws IOException {
        return new CompanyTickersUniverse(null, null, null, parse(MAPPER.readTree(json)));
    }

    @Override
    public List<Entity> entities() throws IOException {
        List<Entity> loaded = entities;
        if (loaded == null) {
            synchronized (this) {
                loaded = entities;
                if (loaded == null) {
                    loaded = fetch();
                    entities = loaded;
                }
            }
        }
        return new ArrayList<>(loaded);
    }

    private List<Entity> fetch() throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(60))
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("Company tickers feed returned status " + response.statusCode());
            }
            List<Entity> parsed = parse(MAPPER.readTree(response.body()));
            log.info("Loaded {} entities from {}", parsed.size(), url);
            return parsed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching company tickers", e);
        }
    }

    static List<Entity> parse(JsonNode root) throws IOException {
        if (root == null || !root.isObject()) {
            throw new IOException("Company tickers feed is not a JSON object");
        }
        Map<String, Entity> byCik = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode row = field.getValue();
            if (!row.hasNonNull("cik_str")) {
                continue;
            }
            String cik = EdgarFullTextSearchClient.padCik(row.get("cik_str").asText());
            int rank = parseRank(field.getKey(), byCik.size());
            Entity entity = new Entity(cik, row.path("title").asText(null), rank);
            byCik.merge(cik, entity, (existing, candidate) ->
                    candidate.sizeRank() < existing.sizeRank() ? candidate : existing);
        }
        return List.copyOf(byCik.values());
    }

    private static int parseRank(String key, int fallback) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
