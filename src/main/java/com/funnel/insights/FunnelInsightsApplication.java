package com.funnel.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FunnelInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunnelInsightsApplication.class, args);
    }
}
