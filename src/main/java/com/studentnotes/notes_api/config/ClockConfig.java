package com.studentnotes.notes_api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // createdAt / updatedAt 은 항상 UTC 기준
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
