package com.tickercontext.gateway.controller;

import com.tickercontext.common.exception.UpstreamServiceException;
import com.tickercontext.common.time.IsoTimestamps;
import com.tickercontext.common.trace.TraceContextUtil;
import com.tickercontext.gateway.model.RunResponse;
import com.tickercontext.gateway.service.GatewayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

@RestController
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    private final GatewayService gatewayService;
    private final Clock clock;

    public GatewayController(GatewayService gatewayService, Clock clock) {
        this.gatewayService = gatewayService;
        this.clock          = clock;
    }

    @GetMapping("/api/run")
    public Mono<ResponseEntity<RunResponse>> run(
            @RequestParam(value = "ticker", required = false) String ticker,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        if (ticker == null || ticker.isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return gatewayService.run(ticker.trim(), traceId).map(ResponseEntity::ok);
    }

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "ok",
            "service", "gateway",
            "version", "v1",
            "ts", IsoTimestamps.now(clock)));
    }

    @ExceptionHandler(UpstreamServiceException.class)
    public ResponseEntity<Map<String, String>> upstreamFailed(UpstreamServiceException e) {
        log.warn("UPSTREAM_FAILED service={} reason={}", e.getServiceName(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(Map.of("detail", e.getMessage()));
    }
}
