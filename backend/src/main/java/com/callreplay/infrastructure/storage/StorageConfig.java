package com.callreplay.infrastructure.storage;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
