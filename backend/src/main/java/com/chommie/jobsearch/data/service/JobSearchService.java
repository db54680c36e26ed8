package com.chommie.jobsearch.data.service;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.cache.CacheKeys;
import com.chommie.jobsearch.data.cache.ResultCacheManager;
import com.chommie.jobsearch.data.guard.AttemptGuard;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.ErrorCodes;
import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.JobDetails;
import com.chommie.jobsearch.data.model.JobPublishResult;
import com.chommie.jobsearch.data.model.JobSearchFilters;
import com.chommie.jobsearch.data.model.JobSearchPage;
import com.chommie.jobsearch.data.model.JobSearchResult;
import com.chommie.jobsearch.data.model.TrendingJobsResult;
import com.chommie.jobsearch.data.persistence.ApplicationRepository;
import com.chommie.jobsearch.data.persistence.DuplicateRecordException;
import com.chommie.jobsearch.data.persistence.JobRepository;
import com.chommie.jobsearch.data.validation.EntityValidator;
import com.chommie.jobsearch.data.validation.ValidationException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job use cases. Reads go through the result cache; every job mutation drops the whole
 * {@code jobs:} namespace.
 */
@Service
public class JobSearchService {
    private static final Logger log = LoggerFactory.getLogger(JobSearchService.class);
    private static final String JOBS = EntityKind.JOB.resource();
    private static final String APPLICATIONS = EntityKind.APPLICATION.resource();
    private static final int DEFAULT_SIMILAR_LIMIT = 5;
    private static final TypeReference<List<Job>> JOB_LIST = new TypeReference<>() {};

    private final JobRepository jobRepository;
    private final ApplicationRepository applicationRepository;
    private final EntityValidator validator;
    private final ResultCacheManager cache;
    private final AttemptGuard searchGuard;
    private final JobSearchProperties properties;
    private final Clock clock;

    public JobSearchService(
        JobRepository jobRepository,
        ApplicationRepository applicationRepository,
        EntityValidator validator,
        ResultCacheManager cache,
        @Qualifier("searchGuard") AttemptGuard searchGuard,
        JobSearchProperties properties,
        Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.applicationRepository = applicationRepository;
        this.validator = validator;
        this.cache = cache;
        this.searchGuard = searchGuard;
        this.properties = properties;
        this.clock = clock;
    }

    public JobSearchResult searchJobs(JobSearchFilters filters) {
        JobSearchFilters safe = validator.validateSearch(filters);
        String key = CacheKeys.key(JOBS, CacheKeys.SEARCH, safe);
        Optional<JobSearchPage> cached = cache.get(key, JobSearchPage.class);
        if (cached.isPresent()) {
            return JobSearchResult.of(cached.get());
        }
        JobSearchPage page = jobRepository.search(safe);
        cache.set(key, page, Duration.ofSeconds(properties.getCache().getSearchTtlSeconds()));
        return JobSearchResult.of(page);
    }

    /**
     * Search gated by the per-actor search guard. A flooded actor gets an empty, rate-limited
     * result and no store request is made.
     */
    public JobSearchResult searchJobs(String actorKey, JobSearchFilters filters) {
        if (!searchGuard.tryAcquire(actorKey)) {
            return JobSearchResult.limited();
        }
        return searchJobs(filters);
    }

    public Optional<Job> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        String key = CacheKeys.key(JOBS, CacheKeys.BY_ID, jobId);
        Optional<Job> cached = cache.get(key, Job.class);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Job> job = jobRepository.getById(jobId);
        job.ifPresent(value -> cache.set(key, value, Duration.ofSeconds(properties.getCache().getEntityTtlSeconds())));
        return job;
    }

    public Optional<JobDetails> getJobDetails(String jobId, String userId) {
        Optional<Job> job = getJob(jobId);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> similarParams = new LinkedHashMap<>();
        similarParams.put("jobId", jobId);
        similarParams.put("limit", DEFAULT_SIMILAR_LIMIT);
        List<Job> similar = cache.getOrLoad(
            CacheKeys.key(JOBS, CacheKeys.SIMILAR, similarParams),
            JOB_LIST,
            Duration.ofSeconds(properties.getCache().getSimilarTtlSeconds()),
            () -> jobRepository.findSimilarTo(job.get(), DEFAULT_SIMILAR_LIMIT)
        );
        return Optional.of(new JobDetails(job.get(), similar, hasApplied(userId, jobId)));
    }

    public TrendingJobsResult getTrendingJobs(int days, int limit) {
        int safeDays = JobRepository.trendingDays(days);
        int safeLimit = JobRepository.trendingLimit(limit, properties);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("days", safeDays);
        params.put("limit", safeLimit);
        return cache.getOrLoad(
            CacheKeys.key(JOBS, CacheKeys.TRENDING, params),
            new TypeReference<TrendingJobsResult>() {},
            Duration.ofSeconds(properties.getCache().getTrendingTtlSeconds()),
            () -> new TrendingJobsResult(jobRepository.getTrendingJobs(safeDays, safeLimit))
        );
    }

    /**
     * Creates a job unless one with the same title, company and location is already stored.
     */
    public JobPublishResult publishJob(Map<String, ?> data) {
        try {
            Map<String, Object> validated = validator.validate(EntityKind.JOB, data);
            Optional<Job> existing = jobRepository.findByNaturalKey(
                (String) validated.get("title"),
                (String) validated.get("company"),
                (String) validated.get("location")
            );
            if (existing.isPresent()) {
                log.debug("Job {} already published as {}", validated.get("title"), existing.get().id());
                return JobPublishResult.failed(ErrorCodes.DUPLICATE_JOB, List.of());
            }
            Job job = jobRepository.create(data);
            invalidateJobs();
            return JobPublishResult.published(job);
        } catch (ValidationException e) {
            return JobPublishResult.failed(ErrorCodes.VALIDATION_FAILED, e.getFieldErrors());
        } catch (DuplicateRecordException e) {
            return JobPublishResult.failed(ErrorCodes.DUPLICATE_JOB, List.of());
        }
    }

    public Job updateJob(String jobId, Map<String, ?> patch) {
        Job updated = jobRepository.update(jobId, patch);
        invalidateJobs();
        return updated;
    }

    public Job deleteJob(String jobId) {
        Job deleted = jobRepository.delete(jobId);
        invalidateJobs();
        return deleted;
    }

    /**
     * Jobs past their expiry, for the external cleanup scheduler. Not cached.
     */
    public List<Job> findExpiredJobs(int limit) {
        return jobRepository.findExpired(clock.instant(), limit);
    }

    private boolean hasApplied(String userId, String jobId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("userId", userId);
        params.put("jobId", jobId);
        return cache.getOrLoad(
            CacheKeys.key(APPLICATIONS, CacheKeys.HAS_APPLIED, params),
            new TypeReference<Boolean>() {},
            Duration.ofSeconds(properties.getCache().getEntityTtlSeconds()),
            () -> applicationRepository.findByUserAndJob(userId, jobId).isPresent()
        );
    }

    private void invalidateJobs() {
        cache.invalidateByPrefix(EntityKind.JOB.cacheNamespace());
    }
}
