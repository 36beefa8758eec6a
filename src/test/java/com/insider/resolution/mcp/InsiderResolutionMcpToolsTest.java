package com.insider.resolution.mcp;

import com.insider.resolution.api.InsiderResolver;
import com.insider.resolution.support.GaleKlappaFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static com.insider.resolution.support.GaleKlappaFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the MCP tools module.
 */
class InsiderResolutionMcpToolsTest {

    private InsiderResolver resolver;
    private InsiderResolutionMcpTools mcpTools;

    @BeforeEach
    void setUp() {
        resolver = InsiderResolver.builder()
                .indexedSearchClient(GaleKlappaFixture.searchClient())
                .clock(CLOCK)
                .build();
        mcpTools = new InsiderResolutionMcpTools(resolver);
    }

    @AfterEach
    void tearDown() {
        resolver.close();
    }

    private Map<String, Object> call(String tool, Map<String, Object> params) {
        return mcpTools.getTool(tool).orElseThrow().invoke(params);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Object value) {
        return (List<Map<String, Object>>) value;
    }

    @Nested
    @DisplayName("Definitions")
    class DefinitionTests {

        @Test
        @DisplayName("getToolDefinitions returns exactly 3 tools with unique names")
        void returnsThreeTools() {
            List<McpToolDefinition> tools = mcpTools.getToolDefinitions();
            assertEquals(3, tools.size());
            List<String> names = tools.stream().map(McpToolDefinition::name).toList();
            assertEquals(names.size(), new HashSet<>(names).size());
        }

        @Test
        @DisplayName("all tools require person_name")
        void allToolsRequireName() {
            for (McpToolDefinition tool : mcpTools.getToolDefinitions()) {
                assertFalse(tool.description().isBlank());
                assertEquals(List.of("person_name"), tool.inputSchema().get("required"), tool.name());
            }
        }

        @Test
        @DisplayName("getTool returns empty for unknown names")
        void unknownTool() {
            assertTrue(mcpTools.getTool("merge_entities").isEmpty());
        }

        @Test
        @DisplayName("definition rejects missing fields")
        void definitionValidation() {
            assertThrows(NullPointerException.class,
                    () -> new McpToolDefinition(null, "d", Map.of(), p -> p));
            assertThrows(NullPointerException.class,
                    () -> new McpToolDefinition("n", "d", Map.of(), null));
        }
    }

    @Nested
    @DisplayName("get_all_insider_companies")
    class AllCompaniesTests {

        @Test
        @DisplayName("lists current and former companies")
        void listsCompanies() {
            Map<String, Object> result = call("get_all_insider_companies", Map.of("person_name", QUERY));

            assertEquals(true, result.get("found"));
            assertEquals(3, result.get("total_companies"));
            assertEquals(2, result.get("current_companies"));
            assertEquals(1, result.get("former_companies"));
            assertEquals(false, result.get("partial_coverage"));
            assertFalse(result.containsKey("message"));

            Map<String, Object> first = list(result.get("companies")).get(0);
            assertEquals(BMI.id(), first.get("entity_id"));
            assertEquals("BADGER METER INC", first.get("company_name"));
            assertEquals("CURRENT", first.get("status"));
            assertEquals("2025-05-10", first.get("last_filing_date"));
            assertEquals("INDEXED_SEARCH", first.get("strategy"));
        }

        @Test
        @DisplayName("honors include_former and min_transactions")
        void filters() {
            Map<String, Object> current = call("get_all_insider_companies",
                    Map.of("person_name", QUERY, "include_former", false));
            Map<String, Object> frequent = call("get_all_insider_companies",
                    Map.of("person_name", QUERY, "min_transactions", "2"));

            assertEquals(2, current.get("total_companies"));
            assertEquals(1, frequent.get("total_companies"));
            assertEquals(WEC.id(), list(frequent.get("companies")).get(0).get("entity_id"));
        }

        @Test
        @DisplayName("explains an empty result")
        void notFound() {
            Map<String, Object> result = call("get_all_insider_companies", Map.of("person_name", "Nobody Atall"));

            assertEquals(false, result.get("found"));
            assertEquals(0, result.get("total_companies"));
            assertEquals("No insider filings found for Nobody Atall under 3 name variations", result.get("message"));
            assertEquals(2, list(result.get("strategies")).size());
        }

        @Test
        @DisplayName("returns an error entry for invalid input")
        void invalidInput() {
            Map<String, Object> blank = call("get_all_insider_companies", Map.of("person_name", " "));
            Map<String, Object> badLimit = call("get_all_insider_companies",
                    Map.of("person_name", QUERY, "company_limit", 0));

            assertTrue(blank.containsKey("error"));
            assertTrue(badLimit.get("error").toString().contains("entityLimit"));
            assertTrue(call("get_all_insider_companies", null).containsKey("error"));
        }
    }

    @Test
    @DisplayName("get_current_board_positions lists only current roles")
    void currentBoardPositions() {
        Map<String, Object> result = call("get_current_board_positions", Map.of("person_name", QUERY));

        assertEquals(QUERY, result.get("person_name"));
        assertNotNull(result.get("search_date"));
        assertEquals(2, result.get("current_positions_count"));
        assertEquals(List.of(BMI.id(), WEC.id()),
                list(result.get("current_positions")).stream().map(m -> m.get("entity_id")).toList());

        Map<String, Object> none = call("get_current_board_positions", Map.of("person_name", "Nobody Atall"));
        assertEquals("No current positions found for: Nobody Atall", none.get("message"));
    }

    @Test
    @DisplayName("generate_name_variations lists the searched forms")
    void nameVariations() {
        Map<String, Object> result = call("generate_name_variations", Map.of("person_name", QUERY));

        assertEquals(List.of("Gale Klappa", "Klappa, Gale", "KLAPPA GALE"), result.get("variations"));
        assertEquals(3, result.get("count"));
        assertTrue(call("generate_name_variations", Map.of("person_name", "")).containsKey("error"));
    }
}
