package com.siteintel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class ScraperConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(ScraperProperties properties) {
        int size = Math.max(properties.getFetch().getBatchSize(), properties.getEnhancement().getBatchSize());
        return Executors.newFixedThreadPool(Math.max(2, size));
    }

    @Bean(name = "discoveryExecutor", destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getDiscovery().getValidationConcurrency()));
    }

    @Bean(name = "scrapeRunExecutor", destroyMethod = "shutdown")
    public ExecutorService scrapeRunExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(name = "eventSweepScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService eventSweepScheduler() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
