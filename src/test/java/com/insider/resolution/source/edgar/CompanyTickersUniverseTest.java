package com.insider.resolution.source.edgar;

import com.insider.resolution.core.model.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompanyTickersUniverseTest {

    private static CompanyTickersUniverse load() throws IOException {
        try (InputStream in = CompanyTickersUniverseTest.class.getResourceAsStream("/edgar/company_tickers.json")) {
            assertNotNull(in);
            return CompanyTickersUniverse.fromJson(in);
        }
    }

    @Test
    @DisplayName("Should rank entities by feed position and pad their CIKs")
    void testParse() throws IOException {
        List<Entity> entities = load().entities();

        assertEquals(4, entities.size());
        assertEquals(new Entity("0000320193", "Apple Inc.", 0), entities.get(0));
        assertEquals(new Entity("0000783325", "WEC ENERGY GROUP, INC.", 3), entities.get(2));
    }

    @Test
    @DisplayName("Should list an issuer with several tickers once at its best rank")
    void testDuplicateCik() throws IOException {
        List<Entity> alphabet = load().entities().stream()
                .filter(e -> e.id().equals("0001652044"))
                .toList();
        assertEquals(1, alphabet.size());
        assertEquals(1, alphabet.get(0).sizeRank());
    }

    @Test
    @DisplayName("Should return the largest entities first")
    void testTop() throws IOException {
        List<String> top = load().top(2).stream().map(Entity::id).toList();
        assertEquals(List.of("0000320193", "0001652044"), top);
    }

    @Test
    @DisplayName("Should reject a feed that is not an object")
    void testInvalidFeed() {
        InputStream array = new ByteArrayInputStream("[1, 2]".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> CompanyTickersUniverse.fromJson(array));
    }

    @Test
    @DisplayName("Should require a User-Agent for the remote feed")
    void testRemoteRequiresAgent() {
        assertThrows(IllegalArgumentException.class, () -> CompanyTickersUniverse.remote(null));
    }
}
