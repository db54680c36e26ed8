package com.chommie.jobsearch.data.service;

import com.chommie.jobsearch.data.cache.CachedValueCodec;
import com.chommie.jobsearch.data.cache.CaffeineCacheStore;
import com.chommie.jobsearch.data.cache.ResultCacheManager;
import com.chommie.jobsearch.data.model.Application;
import com.chommie.jobsearch.data.model.ApplicationOutcome;
import com.chommie.jobsearch.data.model.ApplicationStatus;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.ErrorCodes;
import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.JobType;
import com.chommie.jobsearch.data.persistence.ApplicationRepository;
import com.chommie.jobsearch.data.persistence.DuplicateRecordException;
import com.chommie.jobsearch.data.persistence.JobRepository;
import com.chommie.jobsearch.data.persistence.RecordNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ApplicationServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private JobRepository jobRepository;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private CaffeineCacheStore cacheStore;
    private ResultCacheManager cache;
    private ApplicationService service;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        cacheStore = new CaffeineCacheStore(100, clock);
        cache = new ResultCacheManager(cacheStore, new CachedValueCodec(mapper, 1024), clock);
        service = new ApplicationService(applicationRepository, jobRepository, cache);
    }

    @AfterEach
    void tearDown() {
        cacheStore.close();
    }

    @Test
    void applyingTwiceIsRejected() {
        when(jobRepository.getById("j1")).thenReturn(Optional.of(job("j1")));
        when(applicationRepository.findByUserAndJob("u1", "j1")).thenReturn(Optional.of(application(ApplicationStatus.PENDING)));

        ApplicationOutcome outcome = service.apply("u1", "j1", "Hello");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).isEqualTo(ErrorCodes.ALREADY_APPLIED);
        verify(applicationRepository, never()).create(anyMap());
    }

    @Test
    void racingDuplicateIsCaughtByTheUniqueIndex() {
        when(jobRepository.getById("j1")).thenReturn(Optional.of(job("j1")));
        when(applicationRepository.findByUserAndJob("u1", "j1")).thenReturn(Optional.empty());
        when(applicationRepository.create(anyMap())).thenThrow(new DuplicateRecordException(EntityKind.APPLICATION, null));

        ApplicationOutcome outcome = service.apply("u1", "j1", null);

        assertThat(outcome.error()).isEqualTo(ErrorCodes.ALREADY_APPLIED);
    }

    @Test
    void applyingToMissingJobFails() {
        when(jobRepository.getById("gone")).thenReturn(Optional.empty());

        ApplicationOutcome outcome = service.apply("u1", "gone", null);

        assertThat(outcome.error()).isEqualTo(ErrorCodes.JOB_NOT_FOUND);
    }

    @Test
    void successfulApplicationInvalidatesDerivedViews() {
        cache.set("applications:has-applied:abc", true, Duration.ofMinutes(5));
        cache.set("jobs:trending:abc", "ranked", Duration.ofMinutes(5));
        cache.set("users:by-id:abc", "profile", Duration.ofMinutes(5));
        cache.set("jobs:by-id:abc", "job", Duration.ofMinutes(5));
        when(jobRepository.getById("j1")).thenReturn(Optional.of(job("j1")));
        when(applicationRepository.findByUserAndJob("u1", "j1")).thenReturn(Optional.empty());
        when(applicationRepository.create(anyMap())).thenReturn(application(ApplicationStatus.PENDING));

        ApplicationOutcome outcome = service.apply("u1", "j1", "Hello");

        assertThat(outcome.success()).isTrue();
        assertThat(cache.get("applications:has-applied:abc", Boolean.class)).isEmpty();
        assertThat(cache.get("jobs:trending:abc", String.class)).isEmpty();
        assertThat(cache.get("users:by-id:abc", String.class)).isEmpty();
        assertThat(cache.get("jobs:by-id:abc", String.class)).contains("job");
    }

    @Test
    void statusUpdateSendsWireValue() {
        when(applicationRepository.update(eq("a1"), eq(Map.of("status", "interview", "notes", "Call booked"))))
            .thenReturn(application(ApplicationStatus.INTERVIEW));

        ApplicationOutcome outcome = service.updateStatus("a1", ApplicationStatus.INTERVIEW, "Call booked");

        assertThat(outcome.application().status()).isEqualTo(ApplicationStatus.INTERVIEW);
    }

    @Test
    void statusUpdateOfMissingApplicationIsReported() {
        when(applicationRepository.update(eq("gone"), anyMap()))
            .thenThrow(new RecordNotFoundException(EntityKind.APPLICATION, "gone"));
        cache.set("applications:has-applied:abc", true, Duration.ofMinutes(5));

        ApplicationOutcome outcome = service.updateStatus("gone", ApplicationStatus.REJECTED, null);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).isEqualTo(ErrorCodes.APPLICATION_NOT_FOUND);
        assertThat(cache.get("applications:has-applied:abc", Boolean.class)).contains(true);
    }

    private static Job job(String id) {
        return new Job(id, "Java Engineer", "Acme", null, null, null, null, null, JobType.FULL_TIME,
            false, true, null, NOW, NOW);
    }

    private static Application application(ApplicationStatus status) {
        return new Application("a1", "u1", "j1", "Hello", status, null, NOW, NOW);
    }
}
