package com.chommie.jobsearch.data.persistence;

import com.chommie.jobsearch.config.JobSearchProperties;
import com.chommie.jobsearch.data.model.EntityKind;
import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.JobSearchFilters;
import com.chommie.jobsearch.data.model.JobSearchPage;
import com.chommie.jobsearch.data.model.JobType;
import com.chommie.jobsearch.data.model.TrendingJob;
import com.chommie.jobsearch.data.ranking.KeywordExtractor;
import com.chommie.jobsearch.data.ranking.RankingEngine;
import com.chommie.jobsearch.data.store.DataMethod;
import com.chommie.jobsearch.data.store.DataResult;
import com.chommie.jobsearch.data.store.QueryFilter;
import com.chommie.jobsearch.data.store.ResourceSchema;
import com.chommie.jobsearch.data.util.Batches;
import com.chommie.jobsearch.data.util.Rows;
import com.chommie.jobsearch.data.validation.EntityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JobRepository extends AbstractStoreRepository<Job> {
    private static final Logger log = LoggerFactory.getLogger(JobRepository.class);
    private static final List<String> TEXT_COLUMNS = List.of("title", "company", "description");
    private static final int MAX_TRENDING_DAYS = 365;

    private final RankingEngine rankingEngine;
    private final KeywordExtractor keywordExtractor;

    public JobRepository(
        StoreRequestExecutor executor,
        EntityValidator validator,
        JobSearchProperties properties,
        Clock clock,
        RankingEngine rankingEngine,
        KeywordExtractor keywordExtractor
    ) {
        super(EntityKind.JOB, executor, validator, properties, clock);
        this.rankingEngine = rankingEngine;
        this.keywordExtractor = keywordExtractor;
    }

    /**
     * One store request covering text match, structured filters and the total count.
     * Salary filters match on range overlap, so a job paying 60k-90k matches a 50k-80k search.
     */
    public JobSearchPage search(JobSearchFilters filters) {
        JobSearchFilters safe = validator.validateSearch(filters);
        JobType jobType = safe.jobType();
        QueryFilter query = QueryFilter.builder()
            .eq("is_active", true)
            .ilikeAny(TEXT_COLUMNS, safe.query())
            .ilike("location", safe.location())
            .eq("job_type", jobType == null ? null : jobType.wireValue())
            .gte("salary_max", safe.salaryMin())
            .lte("salary_min", safe.salaryMax());
        if (safe.remoteOnly()) {
            query.eq("remote_friendly", true);
        }
        DataResult result = get(query
            .orderBy("created_at", false)
            .orderBy("id", true)
            .limit(safe.limit())
            .offset(safe.offset())
            .withCount()
            .build());
        List<Job> jobs = mapRows(result);
        long total = result.totalCount() == null ? jobs.size() : result.totalCount();
        return new JobSearchPage(jobs, total);
    }

    /**
     * Jobs created in the last {@code days} days ranked by application volume. Every job in the
     * window is considered: candidates are read in pages of {@code batchCap}, each page's counts
     * come from one batched request, and only the running top {@code limit} is kept between pages.
     */
    public List<TrendingJob> getTrendingJobs(int days, int limit) {
        int safeDays = trendingDays(days);
        int safeLimit = trendingLimit(limit, properties);
        int pageSize = properties.getStore().getBatchCap();
        Instant since = clock.instant().minus(Duration.ofDays(safeDays));
        List<TrendingJob> top = List.of();
        int offset = 0;
        while (true) {
            List<Job> page = mapRows(get(QueryFilter.builder()
                .eq("is_active", true)
                .gte("created_at", since)
                .orderBy("created_at", false)
                .orderBy("id", true)
                .limit(pageSize)
                .offset(offset)
                .build()));
            if (page.isEmpty()) {
                break;
            }
            List<Job> candidates = new ArrayList<>(top.size() + page.size());
            Map<String, Long> counts = new HashMap<>();
            for (TrendingJob ranked : top) {
                candidates.add(ranked.job());
                counts.put(ranked.job().id(), ranked.applicationCount());
            }
            List<String> ids = new ArrayList<>(page.size());
            for (Job job : page) {
                ids.add(job.id());
            }
            candidates.addAll(page);
            counts.putAll(applicationCounts(ids));
            top = rankingEngine.rankTrending(candidates, counts, safeLimit);
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        return top;
    }

    public static int trendingDays(int days) {
        return Math.max(1, Math.min(days, MAX_TRENDING_DAYS));
    }

    public static int trendingLimit(int limit, JobSearchProperties properties) {
        return Math.max(1, Math.min(limit, properties.getStore().getMaxSearchLimit()));
    }

    /**
     * Jobs sharing the source job's top keywords, in keyword order. Empty when the source job
     * does not exist.
     */
    public List<Job> getSimilarJobs(String jobId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Optional<Job> source = getById(jobId);
        if (source.isEmpty()) {
            return List.of();
        }
        return findSimilarTo(source.get(), limit);
    }

    public List<Job> findSimilarTo(Job source, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, properties.getStore().getMaxSearchLimit()));
        String text = (source.title() == null ? "" : source.title()) + " "
            + (source.description() == null ? "" : source.description());
        List<String> keywords = keywordExtractor.extractKeywords(text, properties.getStore().getSimilarKeywordCount());
        List<List<Job>> resultSets = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            // One extra row so the source job can be dropped without coming up short.
            resultSets.add(search(JobSearchFilters.ofQuery(keyword, safeLimit + 1)).jobs());
        }
        log.debug("Similar jobs for {} from keywords {}", source.id(), keywords);
        return rankingEngine.mergeSimilar(source.id(), resultSets, safeLimit);
    }

    /**
     * Application counts keyed by job id. Jobs without applications are absent.
     */
    public Map<String, Long> applicationCounts(Collection<String> jobIds) {
        Map<String, Long> counts = new HashMap<>();
        if (jobIds == null || jobIds.isEmpty()) {
            return counts;
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(jobIds));
        for (List<String> chunk : Batches.partition(distinct, properties.getStore().getBatchCap())) {
            DataResult result = executor.execute(
                DataMethod.GET,
                ResourceSchema.JOB_APPLICATION_COUNTS,
                QueryFilter.builder().in("job_id", chunk).build()
            );
            for (Map<String, Object> row : result.rows()) {
                String jobId = Rows.string(row, "job_id");
                if (jobId != null) {
                    counts.merge(jobId, Rows.longValue(row, "application_count"), Long::sum);
                }
            }
        }
        return counts;
    }

    /**
     * Active jobs whose expiry has passed, oldest expiry first. Used by the cleanup job.
     */
    public List<Job> findExpired(Instant now, int limit) {
        int safeLimit = Math.max(1, Math.min(limit, properties.getStore().getBatchCap()));
        return mapRows(get(QueryFilter.builder()
            .eq("is_active", true)
            .lte("expires_at", now)
            .orderBy("expires_at", true)
            .orderBy("id", true)
            .limit(safeLimit)
            .build()));
    }

    public Optional<Job> findByNaturalKey(String title, String company, String location) {
        if (title == null || company == null) {
            return Optional.empty();
        }
        QueryFilter query = QueryFilter.builder()
            .eq("title", title.trim())
            .eq("company", company.trim());
        if (location == null || location.isBlank()) {
            query.isNull("location");
        } else {
            query.eq("location", location.trim());
        }
        return get(query.limit(1).build()).firstRow().map(this::mapRow);
    }

    @Override
    protected Job mapRow(Map<String, Object> row) {
        return new Job(
            Rows.string(row, "id"),
            Rows.string(row, "title"),
            Rows.string(row, "company"),
            Rows.string(row, "location"),
            Rows.string(row, "description"),
            Rows.string(row, "url"),
            Rows.integer(row, "salary_min"),
            Rows.integer(row, "salary_max"),
            JobType.fromWire(Rows.string(row, "job_type")),
            Rows.bool(row, "remote_friendly", false),
            Rows.bool(row, "is_active", true),
            Rows.instant(row, "expires_at"),
            Rows.instant(row, "created_at"),
            Rows.instant(row, "updated_at")
        );
    }
}
