package com.tickercontext.features.controller;

import com.tickercontext.common.model.FeaturePayload;
import com.tickercontext.common.model.OneLiner;
import com.tickercontext.common.model.OneLinerRequest;
import com.tickercontext.common.trace.TraceContextUtil;
import com.tickercontext.features.oneliner.OneLinerComposer;
import com.tickercontext.features.service.FeatureAggregator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class FeatureController {

    private final FeatureAggregator aggregator;

    public FeatureController(FeatureAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping("/api/features")
    public ResponseEntity<FeaturePayload> featuresStub(@RequestParam String ticker) {
        if (ticker.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(aggregator.stubPayload(ticker));
    }

    @GetMapping("/api/features/v2")
    public Mono<ResponseEntity<FeaturePayload>> features(
            @RequestParam String ticker,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        if (ticker.isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return TraceContextUtil.withTraceId(aggregator.featuresFor(ticker).map(ResponseEntity::ok), traceId);
    }

    @PostMapping("/api/one_liner")
    public ResponseEntity<OneLiner> oneLiner(@RequestBody OneLinerRequest request) {
        return ResponseEntity.ok(OneLinerComposer.compose(
            request.classification(), request.confidence(), request.publisher(), request.refs()));
    }

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "service", "features", "version", "v1"));
    }
}
