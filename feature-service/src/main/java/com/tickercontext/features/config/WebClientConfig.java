package com.tickercontext.features.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tickercontext.common.exception.ProviderException;
import com.tickercontext.features.client.FinnhubWebClient;
import com.tickercontext.features.client.TiingoWebClient;
import com.tickercontext.features.client.YahooNewsWebClient;
import com.tickercontext.features.sentiment.SentimentClient;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per upstream, each on its own Reactor Netty client with connect,
 * response and read timeouts matching the provider timeout.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${providers.finnhub.base-url:https://finnhub.io}")
    private String finnhubBaseUrl;

    @Value("${providers.finnhub.api-key:}")
    private String finnhubApiKey;

    @Value("${providers.tiingo.base-url:https://api.tiingo.com}")
    private String tiingoBaseUrl;

    @Value("${providers.tiingo.api-key:}")
    private String tiingoApiKey;

    @Value("${providers.yahoo.base-url:https://query1.finance.yahoo.com}")
    private String yahooBaseUrl;

    @Value("${features.sentiment.base-url:http://127.0.0.1:8016}")
    private String sentimentBaseUrl;

    @Value("${features.sentiment.timeout-seconds:6}")
    private double sentimentTimeoutSeconds;

    @Value("${features.provider-timeout-seconds:6}")
    private double providerTimeoutSeconds;

    @Bean
    public FinnhubWebClient finnhubClient(WebClient.Builder builder, ObjectMapper objectMapper, Clock clock) {
        WebClient webClient = build(builder, finnhubBaseUrl, FinnhubWebClient.NAME, seconds(providerTimeoutSeconds));
        return new FinnhubWebClient(webClient, objectMapper, finnhubApiKey, clock);
    }

    @Bean
    public TiingoWebClient tiingoClient(WebClient.Builder builder, ObjectMapper objectMapper, Clock clock) {
        WebClient webClient = build(builder, tiingoBaseUrl, TiingoWebClient.NAME, seconds(providerTimeoutSeconds));
        return new TiingoWebClient(webClient, objectMapper, tiingoApiKey, clock);
    }

    @Bean
    public YahooNewsWebClient yahooNewsClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        WebClient webClient = build(builder, yahooBaseUrl, YahooNewsWebClient.NAME, seconds(providerTimeoutSeconds));
        return new YahooNewsWebClient(webClient, objectMapper);
    }

    @Bean
    public SentimentClient sentimentClient(WebClient.Builder builder) {
        Duration timeout = seconds(sentimentTimeoutSeconds);
        return new SentimentClient(build(builder, sentimentBaseUrl, "sentiment", timeout), timeout);
    }

    private WebClient build(WebClient.Builder builder, String baseUrl, String upstream, Duration timeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .responseTimeout(timeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.USER_AGENT, "ticker-context/1.0")
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(upstream))
            .filter(loggingFilter())
            .build();
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    private ExchangeFilterFunction serverErrorFilter(String upstream) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return clientResponse.releaseBody()
                    .then(Mono.<ClientResponse>error(new ProviderException(upstream, "server error " + clientResponse.statusCode())));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("(token|apikey)=[^&]+", "$1=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
