package com.tradeadvisor.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate advisorRestTemplate(AdvisorProperties advisorProperties) {
        AdvisorProperties.Api api = advisorProperties.getApi();
        return restTemplate(api.getConnectTimeoutMs(), api.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate marketDataRestTemplate(MarketDataProperties marketDataProperties) {
        return restTemplate(marketDataProperties.getConnectTimeoutMs(), marketDataProperties.getReadTimeoutMs());
    }

    private RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
