package com.feedblend.common.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ItemTest {

    private static final Instant T = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    // ── construction ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("tags are trimmed, lower-cased, de-duplicated and sorted")
        void normalizesTags() {
            Item item = Item.of("1", "a", T, " Java", "art", "JAVA", "", null);
            assertEquals(List.of("art", "java"), List.copyOf(item.getTags()));
        }

        @Test
        @DisplayName("missing engagement defaults to zero counts")
        void defaultEngagement() {
            Item item = new Item("1", "a", T, null, null, false);
            assertEquals(EngagementCounts.NONE, item.getEngagement());
            assertTrue(item.getTags().isEmpty());
        }

        @Test
        @DisplayName("id and created_at are required")
        void requiredFields() {
            assertThrows(NullPointerException.class, () -> Item.of(null, "a", T));
            assertThrows(NullPointerException.class, () -> Item.of("1", "a", null));
        }

        @Test
        @DisplayName("tag overlap is case-insensitive and needs both sides tagged")
        void tagOverlap() {
            assertTrue(Item.of("1", "a", T, "Music").sharesTagWith(Item.of("2", "b", T, "music", "art")));
            assertFalse(Item.of("1", "a", T, "music").sharesTagWith(Item.of("2", "b", T, "art")));
            assertFalse(Item.of("1", "a", T).sharesTagWith(Item.of("2", "b", T)));
        }
    }

    // ── set-once annotations ───────────────────────────────────────────────

    @Nested
    @DisplayName("annotations")
    class Annotations {

        @Test
        @DisplayName("score can be assigned once")
        void scoreOnce() {
            Item scored = Item.of("1", "a", T).withScore(0.4);
            assertEquals(0.4, scored.getScore());
            assertThrows(IllegalStateException.class, () -> scored.withScore(0.5));
        }

        @Test
        @DisplayName("source hint can be attached once")
        void hintOnce() {
            Item hinted = Item.of("1", "a", T).withSourceHint("cold_start", "why");
            assertThrows(IllegalStateException.class, () -> hinted.withSourceHint("other", "why"));
        }

        @Test
        @DisplayName("an item is injected at most once")
        void injectedOnce() {
            Item injected = Item.of("1", "a", T).injectedAt(T.minusSeconds(5), "uniform");
            assertTrue(injected.isInjected());
            assertEquals(T.minusSeconds(5), injected.getCreatedAt());
            assertThrows(IllegalStateException.class, () -> injected.injectedAt(T, "uniform"));
        }

        @Test
        @DisplayName("annotation returns a copy and leaves the original untouched")
        void copies() {
            Item original = Item.of("1", "a", T);
            original.withScore(0.9).injectedAt(T.minusSeconds(1), "after_n");

            assertNull(original.getScore());
            assertFalse(original.isInjected());
            assertEquals(T, original.getCreatedAt());
        }
    }

    // ── JSON ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("json")
    class Json {

        @Test
        @DisplayName("reads snake_case input and ignores client-supplied annotations")
        void readsInput() throws Exception {
            String json = "{\"id\":\"p1\",\"author_id\":\"alice\",\"created_at\":\"2024-05-01T12:00:00Z\","
                + "\"tags\":[\"Tech\"],\"engagement\":{\"replies\":2,\"boosts\":1,\"favorites\":0},"
                + "\"injected\":true,\"score\":0.99}";

            Item item = mapper.readValue(json, Item.class);

            assertEquals("alice", item.getAuthorId());
            assertEquals(T, item.getCreatedAt());
            assertEquals(3, item.getEngagement().total());
            assertTrue(item.getTags().contains("tech"));
            assertFalse(item.isInjected());
            assertNull(item.getScore());
        }

        @Test
        @DisplayName("writes injection metadata with snake_case names")
        void writesOutput() throws Exception {
            Item injected = Item.of("r1", "bob", T, "art")
                .withScore(0.42)
                .withSourceHint(InjectionMetadata.SOURCE_RECOMMENDATION, "Recently posted")
                .injectedAt(T.minusSeconds(30), "tag_match");

            JsonNode node = mapper.readTree(mapper.writeValueAsString(injected));

            assertEquals("bob", node.get("author_id").asText());
            assertEquals("2024-05-01T11:59:30Z", node.get("created_at").asText());
            assertTrue(node.get("injected").asBoolean());
            JsonNode metadata = node.get("injection_metadata");
            assertEquals("recommendation_engine", metadata.get("source").asText());
            assertEquals("tag_match", metadata.get("strategy").asText());
            assertEquals(0.42, metadata.get("score").asDouble(), 1e-12);
        }

        @Test
        @DisplayName("metadata without a score omits the field")
        void omitsNullScore() throws Exception {
            Item injected = Item.of("r1", "bob", T).injectedAt(T.minusSeconds(30), "uniform");

            JsonNode metadata = mapper.readTree(mapper.writeValueAsString(injected)).get("injection_metadata");

            assertFalse(metadata.has("score"));
            assertEquals(InjectionMetadata.SOURCE_TIMELINE, metadata.get("source").asText());
        }
    }
}
