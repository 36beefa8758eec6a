package com.insider.resolution.mcp;

import com.insider.resolution.api.InsiderResolver;
import com.insider.resolution.api.InvalidQueryException;
import com.insider.resolution.api.ResolutionOptions;
import com.insider.resolution.core.model.Affiliation;
import com.insider.resolution.core.model.EntityFetchError;
import com.insider.resolution.core.model.NameVariant;
import com.insider.resolution.core.model.ResolutionDiagnostics;
import com.insider.resolution.core.model.ResolvedIdentity;
import com.insider.resolution.core.model.StrategyAttempt;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds MCP (Model Context Protocol) tool definitions over an {@link InsiderResolver}.
 *
 * <p>Available tools:</p>
 * <ul>
 *   <li>{@code get_all_insider_companies} -- every entity where a person is or was an insider</li>
 *   <li>{@code get_current_board_positions} -- only the current affiliations of a person</li>
 *   <li>{@code generate_name_variations} -- the name forms a person would be searched under</li>
 * </ul>
 *
 * <p>Invalid names and parameters produce an {@code error} entry instead of an exception, so the
 * agent sees why the call was rejected.</p>
 */
public final class InsiderResolutionMcpTools {

    private final InsiderResolver resolver;

    public InsiderResolutionMcpTools(InsiderResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver is required");
    }

    /**
     * Returns all 3 tool definitions.
     */
    public List<McpToolDefinition> getToolDefinitions() {
        return List.of(
                buildAllInsiderCompaniesTool(),
                buildCurrentBoardPositionsTool(),
                buildNameVariationsTool()
        );
    }

    /**
     * Finds a tool definition by name.
     */
    public Optional<McpToolDefinition> getTool(String name) {
        return getToolDefinitions().stream()
                .filter(t -> t.name().equals(name))
                .findFirst();
    }

    private McpToolDefinition buildAllInsiderCompaniesTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "person_name", Map.of("type", "string", "description", "Full name of the person"),
                        "include_former", Map.of("type", "boolean", "description",
                                "Include entities where the person was formerly an insider (default true)"),
                        "min_transactions", Map.of("type", "integer", "description",
                                "Minimum number of supporting filings per entity (default 1)"),
                        "company_limit", Map.of("type", "integer", "description",
                                "Only scan this many of the largest entities when falling back to a full scan")
                ),
                "required", List.of("person_name")
        );

        return new McpToolDefinition(
                "get_all_insider_companies",
                "Find all entities where a person is or was an insider, searching across every public filer.",
                schema,
                params -> {
                    String personName = stringParam(params, "person_name");
                    try {
                        ResolutionOptions.Builder options = resolver.getDefaultOptions().toBuilder()
                                .includeFormer(booleanParam(params, "include_former", true))
                                .minFilings(intParam(params, "min_transactions", 1));
                        if (params.get("company_limit") != null) {
                            options.entityLimit(intParam(params, "company_limit", 0));
                        }
                        ResolvedIdentity identity = resolver.resolveIdentity(personName, options.build());
                        return toIdentityMap(identity);
                    } catch (IllegalArgumentException e) {
                        return errorMap(personName, e);
                    }
                }
        );
    }

    private McpToolDefinition buildCurrentBoardPositionsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "person_name", Map.of("type", "string", "description", "Full name of the person")
                ),
                "required", List.of("person_name")
        );

        return new McpToolDefinition(
                "get_current_board_positions",
                "Get only the current reporting roles of a person, excluding former positions.",
                schema,
                params -> {
                    String personName = stringParam(params, "person_name");
                    try {
                        List<Affiliation> current = resolver.currentPositions(personName);
                        Map<String, Object> result = new LinkedHashMap<>();
                        result.put("person_name", personName);
                        result.put("search_date", LocalDate.now().toString());
                        result.put("current_positions_count", current.size());
                        result.put("current_positions", current.stream().map(this::toAffiliationMap).toList());
                        if (current.isEmpty()) {
                            result.put("message", "No current positions found for: " + personName);
                        }
                        return result;
                    } catch (InvalidQueryException e) {
                        return errorMap(personName, e);
                    }
                }
        );
    }

    private McpToolDefinition buildNameVariationsTool() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "person_name", Map.of("type", "string", "description", "Name to expand")
                ),
                "required", List.of("person_name")
        );

        return new McpToolDefinition(
                "generate_name_variations",
                "List the name forms (filing order, nicknames) a person is searched under.",
                schema,
                params -> {
                    String personName = stringParam(params, "person_name");
                    try {
                        Set<NameVariant> variants = resolver.nameVariations(personName);
                        Map<String, Object> result = new LinkedHashMap<>();
                        result.put("person_name", personName);
                        result.put("variations", variants.stream().map(NameVariant::text).toList());
                        result.put("count", variants.size());
                        return result;
                    } catch (InvalidQueryException e) {
                        return errorMap(personName, e);
                    }
                }
        );
    }

    private Map<String, Object> toIdentityMap(ResolvedIdentity identity) {
        ResolutionDiagnostics diagnostics = identity.diagnostics();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("person_name", identity.query());
        result.put("canonical_name", identity.canonicalName());
        result.put("found", identity.found());
        result.put("confidence", identity.confidence());
        result.put("total_companies", identity.affiliations().size());
        result.put("current_companies", identity.currentAffiliations().size());
        result.put("former_companies", identity.formerAffiliations().size());
        result.put("companies", identity.affiliations().stream().map(this::toAffiliationMap).toList());
        result.put("name_variations_searched", diagnostics.variantsTried());
        result.put("strategies", diagnostics.strategiesAttempted().stream().map(this::toAttemptMap).toList());
        result.put("partial_coverage", diagnostics.partialCoverage());
        result.put("entities_scanned", diagnostics.entitiesScanned());
        result.put("entity_errors", diagnostics.entityErrors().stream().map(this::toErrorMap).toList());
        result.put("cache_hit", diagnostics.cacheHit());
        if (!identity.found()) {
            result.put("message", "No insider filings found for " + identity.query()
                    + " under " + diagnostics.variantsTried().size() + " name variations"
                    + (diagnostics.partialCoverage() ? "; the search was incomplete" : ""));
        }
        return result;
    }

    private Map<String, Object> toAffiliationMap(Affiliation a) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("entity_id", a.entityId());
        map.put("company_name", a.entity().displayName());
        map.put("status", a.status().name());
        map.put("confidence", a.confidence());
        map.put("matched_name", a.matchedName());
        map.put("alternate_names", a.alternateNames());
        map.put("last_filing_date", a.lastFilingDate() != null ? a.lastFilingDate().toString() : null);
        map.put("filing_count", a.filingCount());
        map.put("strategy", a.strategy() != null ? a.strategy().name() : null);
        return map;
    }

    private Map<String, Object> toAttemptMap(StrategyAttempt attempt) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("strategy", attempt.strategy().name());
        map.put("status", attempt.status().name());
        map.put("match_count", attempt.matchCount());
        map.put("detail", attempt.detail());
        return map;
    }

    private Map<String, Object> toErrorMap(EntityFetchError error) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("entity_id", error.entityId());
        map.put("reason", error.reason().name());
        map.put("message", error.message());
        return map;
    }

    private static Map<String, Object> errorMap(String personName, IllegalArgumentException e) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("person_name", personName);
        map.put("error", e.getMessage());
        return map;
    }

    private static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        return value != null ? value.toString() : null;
    }

    private static boolean booleanParam(Map<String, Object> params, String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null ? Boolean.parseBoolean(value.toString()) : defaultValue;
    }

    private static int intParam(Map<String, Object> params, String key, int defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        return value != null ? Integer.parseInt(value.toString()) : defaultValue;
    }
}
