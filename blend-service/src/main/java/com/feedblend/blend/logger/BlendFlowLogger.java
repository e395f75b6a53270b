package com.feedblend.blend.logger;

import com.feedblend.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for one blend request. Never changes pipeline behaviour.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}</li>
 *   <li>{@link #MODE_RESOLVED}: tracking level mapped by the privacy gate</li>
 *   <li>{@link #CANDIDATES_RANKED} or {@link #COLD_START_SELECTED}</li>
 *   <li>{@link #TIMELINE_MERGED}</li>
 *   <li>{@link #RESPONSE_READY}: emitted from the reactive chain</li>
 * </ol>
 *
 * <p>Only the pseudonymized user alias is ever logged.
 */
@Component
public class BlendFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(BlendFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String MODE_RESOLVED       = "MODE_RESOLVED";
    public static final String CANDIDATES_RANKED   = "CANDIDATES_RANKED";
    public static final String COLD_START_SELECTED = "COLD_START_SELECTED";
    public static final String TIMELINE_MERGED     = "TIMELINE_MERGED";
    public static final String RESPONSE_READY      = "RESPONSE_READY";

    /**
     * {@code doOnEach} consumer reading the traceId from the Reactor Context.
     * Fires on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[BlendFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void received(String traceId, String userAlias, int realCount, int candidateCount) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[BlendFlow] stage={} user={} real={} candidates={} traceId={}",
                     REQUEST_RECEIVED, userAlias, realCount, candidateCount, traceId)
        );
    }

    public void modeResolved(String traceId, String trackingLevel, String mode, boolean profileUsable) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[BlendFlow] stage={} trackingLevel={} mode={} profileUsable={} traceId={}",
                     MODE_RESOLVED, trackingLevel, mode, profileUsable, traceId)
        );
    }

    public void injectableReady(String traceId, String stageName, int poolSize, int selected) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[BlendFlow] stage={} pool={} selected={} traceId={}",
                     stageName, poolSize, selected, traceId)
        );
    }

    public void merged(String traceId, String strategy, int budget, int injected, int total) {
        TraceContextUtil.withMdc(traceId, () -> {
            log.info("[BlendFlow] stage={} strategy={} injected={}/{} total={} traceId={}",
                     TIMELINE_MERGED, strategy, injected, budget, total, traceId);
            if (injected < budget) {
                log.debug("[BlendFlow] partial injection: {} of {} placed (gap constraints) traceId={}",
                          injected, budget, traceId);
            }
        });
    }
}
