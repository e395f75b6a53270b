package com.feedblend.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Request tracing helpers for the blend pipeline.
 *
 * <p>The Reactor Context carries the traceId through a request. MDC is written only
 * for the duration of one log call and cleared straight after, so pooled threads never
 * leak a traceId into another request's logs.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(blendMono, traceId);
 *     ...
 *     signal -> TraceContextUtil.getTraceId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    /** Incoming header whose value, when present, is reused as the traceId. */
    public static final String TRACE_HEADER = "X-Trace-Id";

    private static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code candidate} when it is non-blank, otherwise a fresh traceId. */
    public static String resolve(String candidate) {
        return candidate == null || candidate.isBlank() ? newTraceId() : candidate.trim();
    }

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly; {@code contextWrite} is visible to every operator upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** @return the traceId in {@code ctx}, or {@code "unknown"}; never {@code null} */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} in MDC, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
