package com.tradeadvisor.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeAdvisorApplication.class, args);
    }
}
