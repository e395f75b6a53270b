package com.feedblend.blend.service;

import com.feedblend.blend.config.BlendProperties;
import com.feedblend.blend.dto.BlendResponse;
import com.feedblend.blend.dto.FeedSource;
import com.feedblend.blend.logger.BlendFlowLogger;
import com.feedblend.common.coldstart.ColdStartSelector;
import com.feedblend.common.merge.TimelineMerger;
import com.feedblend.common.model.InjectionStrategy;
import com.feedblend.common.model.Item;
import com.feedblend.common.model.PersonalizationMode;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.WeightConfig;
import com.feedblend.common.privacy.PrivacyGate;
import com.feedblend.common.privacy.UserAliasGenerator;
import com.feedblend.common.scoring.CandidateRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Coordinates one blend request:
 * <pre>
 *   PrivacyGate.mode ─┬─ scoring allowed + usable profile → CandidateRanker (ScoreModel)
 *                     │                                      └ empty ranking → cold start
 *                     └─ otherwise                          → ColdStartSelector
 *                                          ↓
 *                               TimelineMerger.merge(real, injectable, strategy)
 * </pre>
 *
 * <p>A profile is usable when the gate lets it through and its interaction count
 * reaches the configured floor. Synthetic candidates are dropped unless enabled.
 *
 * <p>Synchronous and free of shared mutable state; the controller runs it inside
 * {@code Mono.fromCallable}.
 */
@Service
public class TimelineBlendService {

    private static final Logger log = LoggerFactory.getLogger(TimelineBlendService.class);

    private final CandidateRanker candidateRanker;
    private final ColdStartSelector coldStartSelector;
    private final TimelineMerger timelineMerger;
    private final WeightConfig weightConfig;
    private final BlendProperties properties;
    private final UserAliasGenerator aliasGenerator;
    private final BlendFlowLogger flowLogger;

    public TimelineBlendService(CandidateRanker candidateRanker,
                                ColdStartSelector coldStartSelector,
                                TimelineMerger timelineMerger,
                                WeightConfig weightConfig,
                                BlendProperties properties,
                                UserAliasGenerator aliasGenerator,
                                BlendFlowLogger flowLogger) {
        this.candidateRanker   = candidateRanker;
        this.coldStartSelector = coldStartSelector;
        this.timelineMerger    = timelineMerger;
        this.weightConfig      = weightConfig;
        this.properties        = properties;
        this.aliasGenerator    = aliasGenerator;
        this.flowLogger        = flowLogger;
    }

    /**
     * @throws com.feedblend.common.exception.InvalidWeightConfigException on negative weights
     */
    public BlendResponse blend(BlendCommand command) {
        String traceId = command.traceId();
        InjectionStrategy strategy = command.strategy();
        String userAlias = aliasGenerator.alias(command.userId());
        flowLogger.received(traceId, userAlias, command.realItems().size(), command.candidates().size());

        PersonalizationMode mode = PrivacyGate.mode(command.trackingLevel());

        if (!command.inject()) {
            List<Item> untouched = timelineMerger.merge(command.realItems(), List.of(), strategy);
            return new BlendResponse(untouched, mode, FeedSource.NONE, 0, strategy.type().value());
        }

        List<Item> pool = eligibleCandidates(command.candidates());
        Optional<SignalProfile> restricted = PrivacyGate.allowsScoring(mode)
            ? PrivacyGate.restrict(command.profile(), mode)
            : Optional.empty();
        boolean profileUsable = restricted
            .map(p -> p.interactionCount() >= properties.minInteractions())
            .orElse(false);
        flowLogger.modeResolved(traceId, levelName(command), mode.name(), profileUsable);

        List<Item> injectable = List.of();
        FeedSource source = FeedSource.NONE;

        if (profileUsable) {
            injectable = candidateRanker.rank(pool, restricted.get(), weightConfig);
            flowLogger.injectableReady(traceId, BlendFlowLogger.CANDIDATES_RANKED, pool.size(), injectable.size());
            source = FeedSource.PERSONALIZED;
            if (injectable.isEmpty()) {
                log.info("[TimelineBlendService] No ranked candidates for user={}, falling back to cold start traceId={}",
                         userAlias, traceId);
            }
        }
        if (injectable.isEmpty() && properties.coldStartEnabled()) {
            injectable = coldStartSelector.select(pool, properties.coldStartLimit());
            flowLogger.injectableReady(traceId, BlendFlowLogger.COLD_START_SELECTED, pool.size(), injectable.size());
            source = FeedSource.COLD_START;
        }
        if (injectable.isEmpty()) {
            source = FeedSource.NONE;
        }

        List<Item> merged = timelineMerger.merge(command.realItems(), injectable, strategy);
        int injectedCount = (int) merged.stream().filter(Item::isInjected).count();
        flowLogger.merged(traceId, strategy.type().value(), strategy.budget(injectable.size()),
                          injectedCount, merged.size());

        return new BlendResponse(merged, mode, source, injectedCount, strategy.type().value());
    }

    private List<Item> eligibleCandidates(List<Item> candidates) {
        if (properties.includeSynthetic()) {
            return candidates;
        }
        List<Item> real = candidates.stream().filter(item -> !item.isSynthetic()).toList();
        if (real.size() < candidates.size()) {
            log.debug("[TimelineBlendService] Dropped {} synthetic candidates", candidates.size() - real.size());
        }
        return real;
    }

    private static String levelName(BlendCommand command) {
        return command.trackingLevel() != null ? command.trackingLevel().value() : "default";
    }
}
