package com.chommie.jobsearch.config;

import com.chommie.jobsearch.data.cache.CachedValueCodec;
import com.chommie.jobsearch.data.cache.CaffeineCacheStore;
import com.chommie.jobsearch.data.cache.ResultCacheManager;
import com.chommie.jobsearch.data.guard.AttemptGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class JobSearchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean(name = "storeHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService storeHttpExecutor() {
        return Executors.newFixedThreadPool(4);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean(destroyMethod = "close")
    public CaffeineCacheStore cacheStore(JobSearchProperties properties, Clock clock) {
        return new CaffeineCacheStore(properties.getCache().getMaximumEntries(), clock);
    }

    @Bean
    public CachedValueCodec cachedValueCodec(ObjectMapper objectMapper, JobSearchProperties properties) {
        return new CachedValueCodec(objectMapper, properties.getCache().getCompressionThresholdBytes());
    }

    @Bean
    public ResultCacheManager resultCacheManager(CaffeineCacheStore cacheStore, CachedValueCodec codec, Clock clock) {
        return new ResultCacheManager(cacheStore, codec, clock);
    }

    @Bean
    @Qualifier("loginGuard")
    public AttemptGuard loginGuard(JobSearchProperties properties, Clock clock) {
        JobSearchProperties.Policy policy = properties.getGuard().getLogin();
        return new AttemptGuard("login", policy.getMaxAttempts(), Duration.ofSeconds(policy.getWindowSeconds()), clock);
    }

    @Bean
    @Qualifier("searchGuard")
    public AttemptGuard searchGuard(JobSearchProperties properties, Clock clock) {
        JobSearchProperties.Policy policy = properties.getGuard().getSearch();
        return new AttemptGuard("search", policy.getMaxAttempts(), Duration.ofSeconds(policy.getWindowSeconds()), clock);
    }
}
