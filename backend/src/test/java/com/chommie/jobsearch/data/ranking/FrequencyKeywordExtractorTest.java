package com.chommie.jobsearch.data.ranking;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FrequencyKeywordExtractorTest {
    private final FrequencyKeywordExtractor extractor = new FrequencyKeywordExtractor();

    @Test
    void ranksByFrequencyAndSkipsStopwords() {
        String text = "Senior Java Engineer. The team builds Java services with Kafka and Java tooling; "
            + "the engineer owns Kafka pipelines.";

        assertThat(extractor.extractKeywords(text, 3)).containsExactly("java", "engineer", "kafka");
    }

    @Test
    void tiesKeepFirstSeenOrder() {
        assertThat(extractor.extractKeywords("python rust golang", 2)).containsExactly("python", "rust");
    }

    @Test
    void dropsShortAndNumericTokens() {
        assertThat(extractor.extractKeywords("go js 2024 12345 ux", 5)).isEmpty();
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(extractor.extractKeywords("   ", 3)).isEmpty();
        assertThat(extractor.extractKeywords(null, 3)).isEmpty();
        assertThat(extractor.extractKeywords("java", 0)).isEmpty();
    }
}
