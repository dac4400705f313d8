package com.yerin.openshow.config;

import com.yerin.openshow.infra.Backoff;
import com.yerin.openshow.registry.JobRegistry;
import com.yerin.openshow.registry.JobRegistryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties(JobRegistryProperties.class)
public class JobqConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobRegistry jobRegistry(JobRegistryProperties properties) {
        JobRegistry registry = JobRegistry.from(properties);
        log.info("[JobRegistry] loaded {} job types: {}", registry.types().size(), registry.types());
        return registry;
    }

    @Bean
    public Backoff backoff(@Value("${jobq.retry.base-delay-millis:60000}") long baseDelayMillis,
                           @Value("${jobq.retry.max-delay-millis:86400000}") long maxDelayMillis,
                           @Value("${jobq.retry.hard-ceiling:10}") int hardCeiling,
                           @Value("${jobq.retry.jitter-ratio:0.1}") double jitterRatio) {
        return new Backoff(Duration.ofMillis(baseDelayMillis), Duration.ofMillis(maxDelayMillis),
                hardCeiling, jitterRatio);
    }
}
