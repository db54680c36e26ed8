package com.chommie.jobsearch.data.ranking;

import com.chommie.jobsearch.data.model.Job;
import com.chommie.jobsearch.data.model.JobType;
import com.chommie.jobsearch.data.model.TrendingJob;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RankingEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final RankingEngine engine = new RankingEngine();

    @Test
    void equalCountsPreferMoreRecentJobs() {
        Job a = job("A", NOW.minus(Duration.ofDays(1)));
        Job b = job("B", NOW.minus(Duration.ofDays(6)));

        List<TrendingJob> ranked = engine.rankTrending(List.of(b, a), Map.of("A", 10L, "B", 10L), 10);

        assertThat(ranked).extracting(t -> t.job().id()).containsExactly("A", "B");
    }

    @Test
    void higherCountWinsAndMissingCountIsZero() {
        Job older = job("old", NOW.minus(Duration.ofDays(5)));
        Job newer = job("new", NOW.minus(Duration.ofHours(1)));
        Job quiet = job("quiet", NOW);

        List<TrendingJob> ranked = engine.rankTrending(List.of(newer, quiet, older), Map.of("old", 7L, "new", 3L), 10);

        assertThat(ranked).extracting(t -> t.job().id()).containsExactly("old", "new", "quiet");
        assertThat(ranked.get(2).applicationCount()).isZero();
    }

    @Test
    void identicalCountAndTimestampFallBackToId() {
        Job z = job("z", NOW);
        Job m = job("m", NOW);

        List<TrendingJob> ranked = engine.rankTrending(List.of(z, m), Map.of(), 10);

        assertThat(ranked).extracting(t -> t.job().id()).containsExactly("m", "z");
    }

    @Test
    void trendingIsLimitedAndDeduplicated() {
        Job a = job("a", NOW);
        List<TrendingJob> ranked = engine.rankTrending(
            List.of(a, a, job("b", NOW), job("c", NOW)),
            Map.of("a", 1L, "b", 2L, "c", 3L),
            2
        );

        assertThat(ranked).extracting(t -> t.job().id()).containsExactly("c", "b");
    }

    @Test
    void similarMergeKeepsKeywordOrderAndDropsSource() {
        List<List<Job>> resultSets = List.of(
            List.of(job("src", NOW), job("1", NOW), job("2", NOW)),
            List.of(job("2", NOW), job("3", NOW)),
            List.of(job("4", NOW), job("1", NOW))
        );

        List<Job> merged = engine.mergeSimilar("src", resultSets, 3);

        assertThat(merged).extracting(Job::id).containsExactly("1", "2", "3");
    }

    @Test
    void similarMergeWithNothingToMergeIsEmpty() {
        assertThat(engine.mergeSimilar("src", List.of(List.of(job("src", NOW))), 5)).isEmpty();
        assertThat(engine.mergeSimilar("src", List.of(List.of(job("x", NOW))), 0)).isEmpty();
    }

    private static Job job(String id, Instant createdAt) {
        return new Job(id, "Title " + id, "Acme", null, null, null, null, null, JobType.FULL_TIME,
            false, true, null, createdAt, createdAt);
    }
}
