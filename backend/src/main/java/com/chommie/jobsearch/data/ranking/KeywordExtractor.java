package com.chommie.jobsearch.data.ranking;

import java.util.List;

/**
 * Picks the words of a text that best describe it, most important first.
 */
public interface KeywordExtractor {

    List<String> extractKeywords(String text, int maxCount);
}
