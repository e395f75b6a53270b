package com.feedblend.blend.config;

import com.feedblend.common.coldstart.ColdStartSelector;
import com.feedblend.common.merge.TimelineMerger;
import com.feedblend.common.model.StrategyType;
import com.feedblend.common.model.WeightConfig;
import com.feedblend.common.privacy.UserAliasGenerator;
import com.feedblend.common.scoring.CandidateRanker;
import com.feedblend.common.scoring.ScoreModel;
import com.feedblend.common.scoring.WeightedScoreModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BlendConfig {

    private static final Logger log = LoggerFactory.getLogger(BlendConfig.class);

    @Value("${blend.ranking.weights.author:0.4}")
    private double authorWeight;

    @Value("${blend.ranking.weights.engagement:0.3}")
    private double engagementWeight;

    @Value("${blend.ranking.weights.recency:0.3}")
    private double recencyWeight;

    @Value("${blend.ranking.time-decay-days:7}")
    private double timeDecayDays;

    @Value("${blend.ranking.min-interactions:0}")
    private int minInteractions;

    @Value("${blend.ranking.max-candidates:100}")
    private int maxCandidates;

    @Value("${blend.ranking.min-score:0.1}")
    private double minScore;

    @Value("${blend.ranking.include-synthetic:false}")
    private boolean includeSynthetic;

    @Value("${blend.cold-start.enabled:true}")
    private boolean coldStartEnabled;

    @Value("${blend.cold-start.limit:30}")
    private int coldStartLimit;

    @Value("${blend.injection.default-strategy:uniform}")
    private String defaultStrategy;

    @Value("${blend.injection.default-max:5}")
    private int defaultMaxInjections;

    @Value("${blend.injection.min-gap-minutes:0}")
    private long minGapMinutes;

    @Value("${blend.privacy.user-hash-salt:}")
    private String userHashSalt;

    /**
     * Validated at startup so a negative weight fails the boot instead of every request.
     */
    @Bean
    public WeightConfig weightConfig() {
        WeightConfig configured = new WeightConfig(authorWeight, engagementWeight, recencyWeight, timeDecayDays);
        WeightConfig normalized = configured.normalized();
        if (normalized != configured) {
            log.warn("[BlendConfig] Ranking weights sum to {}; normalized to author={} engagement={} recency={}",
                     configured.weightSum(), normalized.authorWeight(),
                     normalized.engagementWeight(), normalized.recencyWeight());
        }
        return normalized;
    }

    @Bean
    public ScoreModel scoreModel() {
        return new WeightedScoreModel();
    }

    @Bean
    public CandidateRanker candidateRanker(ScoreModel scoreModel) {
        return new CandidateRanker(scoreModel, minScore, maxCandidates);
    }

    @Bean
    public ColdStartSelector coldStartSelector() {
        return new ColdStartSelector();
    }

    @Bean
    public TimelineMerger timelineMerger() {
        return new TimelineMerger();
    }

    @Bean
    public UserAliasGenerator userAliasGenerator() {
        return new UserAliasGenerator(userHashSalt);
    }

    @Bean
    public BlendProperties blendProperties() {
        return new BlendProperties(includeSynthetic, minInteractions, coldStartEnabled, coldStartLimit,
                                   StrategyType.fromValue(defaultStrategy), defaultMaxInjections, minGapMinutes);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // upstream posts carry many fields the engine never reads
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
