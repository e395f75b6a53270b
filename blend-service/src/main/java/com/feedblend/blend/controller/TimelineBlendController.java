package com.feedblend.blend.controller;

import com.feedblend.blend.config.BlendProperties;
import com.feedblend.blend.dto.BlendRequest;
import com.feedblend.blend.dto.BlendResponse;
import com.feedblend.blend.logger.BlendFlowLogger;
import com.feedblend.blend.service.BlendCommand;
import com.feedblend.blend.service.TimelineBlendService;
import com.feedblend.common.model.InjectionStrategy;
import com.feedblend.common.model.StrategyType;
import com.feedblend.common.model.TrackingLevel;
import com.feedblend.common.trace.TraceContextUtil;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/timeline")
public class TimelineBlendController {

    private final TimelineBlendService blendService;
    private final BlendProperties properties;
    private final BlendFlowLogger flowLogger;

    public TimelineBlendController(TimelineBlendService blendService,
                                   BlendProperties properties,
                                   BlendFlowLogger flowLogger) {
        this.blendService = blendService;
        this.properties   = properties;
        this.flowLogger   = flowLogger;
    }

    /**
     * {@code strategy} and {@code limit} map onto the injection strategy type and
     * {@code max_injections}; {@code inject=false} returns the real timeline as-is.
     */
    @PostMapping("/blend")
    public Mono<ResponseEntity<BlendResponse>> blend(
            @RequestBody BlendRequest request,
            @RequestParam(value = "strategy", required = false) String strategy,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "inject", defaultValue = "true") boolean inject,
            @RequestParam(value = "n", required = false) Integer n,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        Mono<BlendResponse> pipeline = Mono
            .fromCallable(() -> blendService.blend(toCommand(request, strategy, limit, inject, n, traceId)))
            .doOnEach(flowLogger.stage(BlendFlowLogger.RESPONSE_READY));
        return TraceContextUtil.withTraceId(pipeline, traceId).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private BlendCommand toCommand(BlendRequest request, String strategyParam, Integer limit,
                                   boolean inject, Integer n, String traceId) {
        StrategyType type = strategyParam == null || strategyParam.isBlank()
            ? properties.defaultStrategy()
            : StrategyType.fromValue(strategyParam);

        InjectionStrategy strategy = InjectionStrategy.of(type)
            .withMaxInjections(limit != null ? limit : properties.defaultMaxInjections())
            .withMinGapMinutes(properties.minGapMinutes());
        if (n != null) {
            strategy = strategy.withN(n);
        }
        if (request.getShuffleSeed() != null) {
            strategy = strategy.withShuffle(request.getShuffleSeed());
        }

        return new BlendCommand(
            traceId,
            request.getUserId(),
            TrackingLevel.fromValue(request.getTrackingLevel()),
            request.getRealItems(),
            request.getCandidates(),
            request.getProfile(),
            strategy,
            inject);
    }
}
