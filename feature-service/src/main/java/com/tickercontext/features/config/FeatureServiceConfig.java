package com.tickercontext.features.config;

import com.tickercontext.features.client.FinnhubWebClient;
import com.tickercontext.features.client.TiingoWebClient;
import com.tickercontext.features.client.YahooNewsWebClient;
import com.tickercontext.features.provider.ProviderSet;
import com.tickercontext.features.service.FeatureSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class FeatureServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(FeatureServiceConfig.class);

    @Value("${features.live-providers:false}")
    private boolean liveProviders;

    @Value("${features.provider-timeout-seconds:6}")
    private double providerTimeoutSeconds;

    @Value("${features.headline-limit:5}")
    private int headlineLimit;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureSettings featureSettings() {
        log.info("Feature settings. liveProviders={} providerTimeoutSeconds={} headlineLimit={}",
                 liveProviders, providerTimeoutSeconds, headlineLimit);
        return new FeatureSettings(liveProviders, Duration.ofMillis(Math.round(providerTimeoutSeconds * 1000)), headlineLimit);
    }

    /**
     * Headlines: Finnhub → Yahoo. Quotes: Tiingo → Finnhub. Candles: Tiingo. Earnings: Finnhub.
     */
    @Bean
    public ProviderSet providerSet(FinnhubWebClient finnhub, TiingoWebClient tiingo, YahooNewsWebClient yahoo) {
        return new ProviderSet(finnhub, yahoo, tiingo, finnhub, tiingo, finnhub);
    }
}
