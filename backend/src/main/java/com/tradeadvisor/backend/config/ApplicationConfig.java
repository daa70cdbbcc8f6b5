package com.tradeadvisor.backend.config;

import com.tradeadvisor.backend.trading.pipeline.NewsFeed;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * No news source is wired by default; a deployment registers its own {@link NewsFeed} bean.
     */
    @Bean
    @ConditionalOnMissingBean(NewsFeed.class)
    public NewsFeed newsFeed() {
        return (ticker, limit) -> List.of();
    }
}
