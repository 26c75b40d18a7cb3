package com.tickercontext.gateway.config;

import com.tickercontext.gateway.client.ResilientServiceClient;
import com.tickercontext.gateway.client.RetrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Value("${services.features.base-url}")
    private String featuresUrl;

    @Value("${services.recommendation.base-url}")
    private String recommendationUrl;

    @Value("${gateway.timeout-seconds:8}")
    private double timeoutSeconds;

    @Value("${gateway.retries:2}")
    private int retries;

    @Value("${gateway.retry-delay-seconds:0.25}")
    private double retryDelaySeconds;

    @Bean
    public RetrySettings retrySettings() {
        RetrySettings settings = new RetrySettings(
            seconds(timeoutSeconds), retries, seconds(retryDelaySeconds));
        log.info("Gateway retry settings: timeout={} retries={} delay={}",
                 settings.timeout(), settings.retries(), settings.delay());
        return settings;
    }

    @Bean
    public ResilientServiceClient featureServiceClient(WebClient.Builder builder, RetrySettings retrySettings) {
        return new ResilientServiceClient("features",
            builder.clone().baseUrl(featuresUrl).build(), retrySettings);
    }

    @Bean
    public ResilientServiceClient recommendationServiceClient(WebClient.Builder builder, RetrySettings retrySettings) {
        return new ResilientServiceClient("recommendation",
            builder.clone().baseUrl(recommendationUrl).build(), retrySettings);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }
}
