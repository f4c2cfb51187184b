package com.alphatransformer.backend.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.TimeUnit;

@Configuration
public class MarketDataHttpConfig {

    @Bean
    public RestTemplate marketRestTemplate(MarketDataProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getRest().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getRest().getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean
    public OkHttpClient streamHttpClient(MarketDataProperties properties) {
        MarketDataProperties.Stream stream = properties.getStream();
        // read timeout 0: the stream is idle between candle updates, pings keep it alive
        return new OkHttpClient.Builder()
                .connectTimeout(stream.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .pingInterval(stream.getPingIntervalSeconds(), TimeUnit.SECONDS)
                .build();
    }
}
