package com.feedblend.blend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feedblend.blend.config.BlendConfig;
import com.feedblend.blend.config.BlendProperties;
import com.feedblend.blend.logger.BlendFlowLogger;
import com.feedblend.blend.service.TimelineBlendService;
import com.feedblend.common.coldstart.ColdStartSelector;
import com.feedblend.common.merge.TimelineMerger;
import com.feedblend.common.model.StrategyType;
import com.feedblend.common.model.WeightConfig;
import com.feedblend.common.privacy.UserAliasGenerator;
import com.feedblend.common.scoring.CandidateRanker;
import com.feedblend.common.scoring.WeightedScoreModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

class TimelineBlendControllerTest {

    private static final String BODY = """
        {
          "userId": "user-1",
          "trackingLevel": "full",
          "realItems": [
            {"id": "P1", "author_id": "friend", "created_at": "2024-05-01T12:00:00Z", "tags": ["tech"]},
            {"id": "P2", "author_id": "friend", "created_at": "2024-05-01T11:00:00Z", "tags": ["tech"]},
            {"id": "P3", "author_id": "friend", "created_at": "2024-05-01T10:00:00Z", "tags": ["art"]}
          ],
          "candidates": [
            {"id": "R1", "author_id": "alice", "created_at": "2024-05-01T09:00:00Z", "tags": ["tech"]},
            {"id": "R2", "author_id": "bob", "created_at": "2024-05-01T08:00:00Z", "tags": ["art"]}
          ],
          "profile": {
            "userAlias": "alias-1",
            "authorAffinity": {"alice": 2.0, "bob": 1.0},
            "now": "2024-05-01T12:00:00Z",
            "interactionCount": 40
          }
        }
        """;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        BlendProperties properties = new BlendProperties(false, 5, true, 20, StrategyType.UNIFORM, 5, 0L);
        BlendFlowLogger flowLogger = new BlendFlowLogger();
        TimelineBlendService service = new TimelineBlendService(
            new CandidateRanker(new WeightedScoreModel(), 0.1, 50),
            new ColdStartSelector(),
            new TimelineMerger(),
            WeightConfig.DEFAULT,
            properties,
            new UserAliasGenerator("test-salt"),
            flowLogger);

        ObjectMapper mapper = new BlendConfig().objectMapper();

        client = WebTestClient
            .bindToController(new TimelineBlendController(service, properties, flowLogger))
            .controllerAdvice(new BlendExceptionHandler())
            .httpMessageCodecs(codecs -> {
                codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
            })
            .build();
    }

    @Test
    @DisplayName("blends a personalized timeline with harmonized timestamps")
    void blendsTimeline() {
        client.post().uri("/api/v1/timeline/blend?strategy=uniform&limit=2")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.source").isEqualTo("personalized")
            .jsonPath("$.mode").isEqualTo("FULL")
            .jsonPath("$.strategy").isEqualTo("uniform")
            .jsonPath("$.injectedCount").isEqualTo(2)
            .jsonPath("$.items.length()").isEqualTo(5)
            .jsonPath("$.items[1].injected").isEqualTo(true)
            .jsonPath("$.items[1].created_at").isEqualTo("2024-05-01T11:36:00Z")
            .jsonPath("$.items[1].injection_metadata.source").isEqualTo("recommendation_engine")
            .jsonPath("$.items[3].created_at").isEqualTo("2024-05-01T10:36:00Z");
    }

    @Test
    @DisplayName("tag_match only injects items sharing a tag with their anchor")
    void tagMatch() {
        client.post().uri("/api/v1/timeline/blend?strategy=tag_match")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.items[1].id").isEqualTo("R1")
            .jsonPath("$.items[1].injection_metadata.strategy").isEqualTo("tag_match");
    }

    @Test
    @DisplayName("inject=false echoes the real timeline")
    void injectDisabled() {
        client.post().uri("/api/v1/timeline/blend?inject=false")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.source").isEqualTo("none")
            .jsonPath("$.injectedCount").isEqualTo(0)
            .jsonPath("$.items.length()").isEqualTo(3);
    }

    @Test
    @DisplayName("unknown strategy is a 400 naming the merger")
    void unknownStrategy() {
        client.post().uri("/api/v1/timeline/blend?strategy=random")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("UnknownStrategyException")
            .jsonPath("$.component").isEqualTo("TimelineMerger");
    }

    @Test
    @DisplayName("invalid tracking level is a 400")
    void invalidTrackingLevel() {
        client.post().uri("/api/v1/timeline/blend")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY.replace("\"full\"", "\"sometimes\""))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.message").isEqualTo("Invalid tracking level: sometimes");
    }

    @Test
    @DisplayName("health endpoint answers OK")
    void health() {
        client.get().uri("/api/v1/timeline/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
