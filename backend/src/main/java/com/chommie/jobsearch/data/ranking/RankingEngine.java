package com.chommie.jobsearch.data.ranking;

import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.TrendingJob;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders already-fetched jobs. Never talks to the store: callers batch-fetch whatever
 * counts or candidates are needed first.
 */
@Component
public class RankingEngine {

    /**
     * Application count descending, then newer {@code createdAt} first, then id ascending so
     * the order is total.
     */
    static final Comparator<TrendingJob> TRENDING_ORDER = Comparator
        .comparingLong(TrendingJob::applicationCount).reversed()
        .thenComparing(t -> t.job().createdAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(t -> t.job().id(), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    public List<TrendingJob> rankTrending(List<Job> candidates, Map<String, Long> applicationCounts, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        Map<String, Long> counts = applicationCounts == null ? Map.of() : applicationCounts;
        Map<String, TrendingJob> unique = new LinkedHashMap<>();
        for (Job job : candidates) {
            if (job == null || job.id() == null) {
                continue;
            }
            unique.putIfAbsent(job.id(), new TrendingJob(job, counts.getOrDefault(job.id(), 0L)));
        }
        List<TrendingJob> ranked = new ArrayList<>(unique.values());
        ranked.sort(TRENDING_ORDER);
        return ranked.size() <= limit ? ranked : new ArrayList<>(ranked.subList(0, limit));
    }

    /**
     * Merges per-keyword result sets in keyword order, keeping the first occurrence of each
     * job and dropping the source job.
     */
    public List<Job> mergeSimilar(String sourceJobId, List<List<Job>> resultSets, int limit) {
        if (resultSets == null || limit <= 0) {
            return List.of();
        }
        Map<String, Job> merged = new LinkedHashMap<>();
        for (List<Job> resultSet : resultSets) {
            if (resultSet == null) {
                continue;
            }
            for (Job job : resultSet) {
                if (merged.size() >= limit) {
                    return new ArrayList<>(merged.values());
                }
                if (job == null || job.id() == null || job.id().equals(sourceJobId)) {
                    continue;
                }
                merged.putIfAbsent(job.id(), job);
            }
        }
        return new ArrayList<>(merged.values());
    }
}
