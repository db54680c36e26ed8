package com.chommie.jobsearch.data.cache;

import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.JobSearchPage;
import com.chommie.jobsearch.data.model.JobType;
import com.chommie.jobsearch.support.MutableClock;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class ResultCacheManagerTest {
    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    private MutableClock clock;
    private CaffeineCacheStore store;
    private ResultCacheManager cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new CaffeineCacheStore(1000, clock);
        cache = new ResultCacheManager(store, new CachedValueCodec(objectMapper(), 512), clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void largeValuesAreCompressedAndReadBackTransparently() {
        String description = "Distributed systems engineer ".repeat(40);
        Job job = job("j1", description);

        cache.set("jobs:by-id:j1", job, Duration.ofMinutes(30));

        assertThat(store.get("jobs:by-id:j1").orElseThrow().compressed()).isTrue();
        assertThat(cache.get("jobs:by-id:j1", Job.class)).contains(job);
    }

    @Test
    void smallValuesStayUncompressed() {
        cache.set("jobs:by-id:j2", job("j2", "short"), Duration.ofMinutes(30));

        assertThat(store.get("jobs:by-id:j2").orElseThrow().compressed()).isFalse();
    }

    @Test
    void entriesExpireAfterTheirTtl() {
        cache.set("jobs:search:abc", new JobSearchPage(List.of(job("j3", "x")), 1), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertThat(cache.get("jobs:search:abc", JobSearchPage.class)).isPresent();

        clock.advance(Duration.ofMinutes(2));
        assertThat(cache.get("jobs:search:abc", JobSearchPage.class)).isEmpty();
    }

    @Test
    void prefixInvalidationOnlyTouchesItsNamespace() {
        cache.set("jobs:by-id:a", job("a", "x"), Duration.ofMinutes(30));
        cache.set("jobs:trending:h", List.of(), Duration.ofMinutes(5));
        cache.set("users:by-id:u", Map.of("id", "u"), Duration.ofMinutes(30));

        int removed = cache.invalidateByPrefix("jobs:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("jobs:by-id:a", Job.class)).isEmpty();
        assertThat(cache.get("users:by-id:u", new TypeReference<Map<String, String>>() {})).isPresent();
    }

    @Test
    void deleteRemovesSingleKey() {
        cache.set("jobs:by-id:a", job("a", "x"), Duration.ofMinutes(30));

        assertThat(cache.delete("jobs:by-id:a")).isTrue();
        assertThat(cache.delete("jobs:by-id:a")).isFalse();
        assertThat(cache.get("jobs:by-id:a", Job.class)).isEmpty();
    }

    @Test
    void multiGetReturnsOnlyHits() {
        cache.multiSet(Map.of("jobs:by-id:a", job("a", "x"), "jobs:by-id:b", job("b", "y")), Duration.ofMinutes(30));

        Map<String, Job> hits = cache.multiGet(List.of("jobs:by-id:a", "jobs:by-id:missing", "jobs:by-id:b"), Job.class);

        assertThat(hits).containsOnlyKeys("jobs:by-id:a", "jobs:by-id:b");
    }

    @Test
    void getOrLoadCallsLoaderOnlyOnMiss() {
        AtomicInteger loads = new AtomicInteger();
        TypeReference<List<String>> type = new TypeReference<>() {};

        List<String> first = cache.getOrLoad("jobs:similar:k", type, Duration.ofMinutes(10), () -> {
            loads.incrementAndGet();
            return List.of("a", "b");
        });
        List<String> second = cache.getOrLoad("jobs:similar:k", type, Duration.ofMinutes(10), () -> {
            loads.incrementAndGet();
            return List.of("other");
        });

        assertThat(first).containsExactly("a", "b");
        assertThat(second).containsExactly("a", "b");
        assertThat(loads).hasValue(1);
    }

    @Test
    void failingStoreDegradesToMiss() {
        CacheStore broken = Mockito.mock(CacheStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("cache down"));
        Mockito.doThrow(new IllegalStateException("cache down")).when(broken).put(anyString(), any());
        when(broken.removeByPrefix(anyString())).thenThrow(new IllegalStateException("cache down"));
        ResultCacheManager degraded = new ResultCacheManager(broken, new CachedValueCodec(objectMapper(), 512), clock);

        degraded.set("jobs:by-id:a", job("a", "x"), Duration.ofMinutes(1));
        Optional<Job> value = degraded.get("jobs:by-id:a", Job.class);

        assertThat(value).isEmpty();
        assertThat(degraded.invalidateByPrefix("jobs:")).isZero();
    }

    @Test
    void keysAreStableForEqualParameters() {
        String first = CacheKeys.key("jobs", CacheKeys.SEARCH, Map.of("query", "java", "limit", 20));
        String second = CacheKeys.key("jobs", CacheKeys.SEARCH, Map.of("limit", 20, "query", "java"));
        String other = CacheKeys.key("jobs", CacheKeys.SEARCH, Map.of("limit", 21, "query", "java"));

        assertThat(first).isEqualTo(second).startsWith("jobs:search:");
        assertThat(other).isNotEqualTo(first);
    }

    private static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private static Job job(String id, String description) {
        return new Job(id, "Engineer", "Acme", "Remote", description, "https://example.com/" + id, 50000, 90000,
            JobType.FULL_TIME, true, true, null, START, START);
    }
}
