package com.insider.resolution.source.edgar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.insider.resolution.source.FilingReference;
import com.insider.resolution.source.IndexedSearchClient;
import com.insider.resolution.strategy.SearchUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Searches Form 4 filings across all issuers through the EDGAR full-text search endpoint.
 *
 * <p>Each hit's {@code display_names} lists the issuer, recognizable by the ticker in
 * parentheses, followed by the reporting owners. One {@link FilingReference} is produced per
 * reporting owner; a hit without owner names yields one reference carrying the searched term.</p>
 *
 * Usage:
 * <pre>
 * IndexedSearchClient client = EdgarFullTextSearchClient.builder()
 *     .userAgent("Example Corp admin@example.com")
 *     .build();
 * </pre>
 */
public class EdgarFullTextSearchClient implements IndexedSearchClient {
    private static final Logger log = LoggerFactory.getLogger(EdgarFullTextSearchClient.class);

    private static final String DEFAULT_BASE_URL = "https://efts.sec.gov/LATEST/search-index";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Period DEFAULT_LOOKBACK = Period.ofYears(5);
    private static final int MAX_PAGE_SIZE = 100;

    private static final Pattern CIK_SUFFIX = Pattern.compile("\\s*\\(CIK\\s*(\\d+)\\)\\s*$");
    private static final Pattern TICKER_SUFFIX = Pattern.compile("\\s*\\(([A-Z0-9.\\-]{1,6}(?:,\\s*[A-Z0-9.\\-]{1,6})*)\\)\\s*$");

    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private final Period lookback;
    private final int pageSize;
    private final Clock clock;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private EdgarFullTextSearchClient(Builder builder) {
        if (builder.userAgent == null || builder.userAgent.isBlank()) {
            throw new IllegalArgumentException("A descriptive User-Agent is required for EDGAR requests");
        }
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.userAgent = builder.userAgent;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.lookback = builder.lookback != null ? builder.lookback : DEFAULT_LOOKBACK;
        this.pageSize = Math.min(MAX_PAGE_SIZE, builder.pageSize > 0 ? builder.pageSize : MAX_PAGE_SIZE);
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public List<FilingReference> search(String term) throws SearchUnavailableException {
        String body = buildRequestBody(term);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl))
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("Searching EDGAR full-text index for '{}'", term);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SearchUnavailableException("EDGAR full-text search unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchUnavailableException("Interrupted while searching EDGAR", e);
        }

        if (response.statusCode() != 200) {
            throw new SearchUnavailableException("EDGAR full-text search returned status " + response.statusCode());
        }
        return parseHits(response.body(), term);
    }

    String buildRequestBody(String term) {
        LocalDate end = LocalDate.now(clock);
        ObjectNode params = objectMapper.createObjectNode()
                .put("q", "\"" + term + "\"")
                .put("dateRange", "custom")
                .put("category", "form-cat1")
                .put("forms", "4")
                .put("startdt", end.minus(lookback).toString())
                .put("enddt", end.toString())
                .put("from", 0)
                .put("size", pageSize);
        return params.toString();
    }

    /**
     * Maps a search response body to filing references.
     *
     * @throws SearchUnavailableException if the body is not the expected shape
     */
    List<FilingReference> parseHits(String body, String term) throws SearchUnavailableException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SearchUnavailableException("Malformed EDGAR search response", e);
        }
        JsonNode hits = root == null ? null : root.path("hits").path("hits");
        if (hits == null || !hits.isArray()) {
            throw new SearchUnavailableException("EDGAR search response has no hits array");
        }

        List<FilingReference> references = new ArrayList<>();
        for (JsonNode hit : hits) {
            JsonNode source = hit.path("_source");
            String accession = text(source.path("adsh"));
            LocalDate filingDate = date(source.path("file_date"));

            String issuerId = null;
            String issuerName = null;
            List<String> owners = new ArrayList<>();
            for (JsonNode displayName : source.path("display_names")) {
                String raw = displayName.asText("");
                Matcher cik = CIK_SUFFIX.matcher(raw);
                String cikValue = cik.find() ? cik.group(1) : null;
                String withoutCik = CIK_SUFFIX.matcher(raw).replaceFirst("").trim();
                Matcher ticker = TICKER_SUFFIX.matcher(withoutCik);
                if (issuerId == null && ticker.find()) {
                    issuerName = ticker.replaceFirst("").trim();
                    issuerId = cikValue;
                } else if (!withoutCik.isEmpty()) {
                    owners.add(withoutCik);
                }
            }
            if (issuerId == null) {
                JsonNode ciks = source.path("ciks");
                issuerId = ciks.isArray() && !ciks.isEmpty() ? ciks.get(0).asText() : null;
            }
            if (issuerId == null) {
                log.debug("Skipping hit {} without an issuer identifier", accession);
                continue;
            }
            String entityId = padCik(issuerId);
            if (owners.isEmpty()) {
                owners.add(term);
            }
            for (String owner : owners) {
                references.add(new FilingReference(entityId, issuerName, owner, filingDate, accession));
            }
        }
        log.debug("EDGAR search for '{}' returned {} hits, {} references", term, hits.size(), references.size());
        return references;
    }

    static String padCik(String cik) {
        String digits = cik.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return cik;
        }
        return "0".repeat(Math.max(0, 10 - digits.length())) + digits;
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static LocalDate date(JsonNode node) {
        String value = text(node);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable filing date '{}'", value);
            return null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String userAgent;
        private Duration timeout;
        private Period lookback;
        private int pageSize;
        private Clock clock;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        /**
         * Required. EDGAR rejects requests without a descriptive agent ("Company contact@host").
         */
        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * How far back filings are searched. Default 5 years.
         */
        public Builder lookback(Period lookback) {
            this.lookback = lookback;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public EdgarFullTextSearchClient build() {
            return new EdgarFullTextSearchClient(this);
        }
    }
}
