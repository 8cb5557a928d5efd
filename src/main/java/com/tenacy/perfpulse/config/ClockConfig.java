package com.tenacy.perfpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // 구간 경계는 항상 UTC 기준
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
