package com.yerin.stylizer.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(JobqProperties.class)
public class JobqConfig {

    private final JobqProperties properties;

    @PostConstruct
    public void init() {
        log.info("JobQ Configuration:");
        log.info("  Concurrency: {}", properties.getWorker().getConcurrency());
        log.info("  Max queue size: {}", properties.getQueue().getMaxSize());
        log.info("  Job timeout: {}", properties.getWorker().getTimeout());
        log.info("  Result ttl: {}, dir={}", properties.getResult().getTtl(), properties.getResult().getDir());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
