package com.chommie.jobsearch.data.ranking;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ranks words by how often they occur, ignoring stopwords and very short tokens. Ties keep
 * the order in which the words first appear.
 */
@Component
public class FrequencyKeywordExtractor implements KeywordExtractor {
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final Set<String> STOPWORDS = Set.of(
        "the", "and", "for", "with", "you", "your", "are", "our", "will", "this", "that", "from",
        "have", "has", "can", "all", "not", "but", "who", "what", "when", "where", "which", "their",
        "they", "them", "been", "was", "were", "into", "about", "also", "more", "any", "able",
        "job", "jobs", "role", "work", "team", "company", "join", "looking", "experience",
        "years", "year", "position", "opportunity", "candidate", "including", "within", "across",
        "must", "should", "would", "could", "such", "other", "well", "new", "per", "etc"
    );

    @Override
    public List<String> extractKeywords(String text, int maxCount) {
        if (text == null || text.isBlank() || maxCount <= 0) {
            return List.of();
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() < MIN_TOKEN_LENGTH || STOPWORDS.contains(token) || isNumeric(token)) {
                continue;
            }
            counts.merge(token, 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts stay in first-seen order.
        entries.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));
        List<String> keywords = new ArrayList<>(Math.min(maxCount, entries.size()));
        for (Map.Entry<String, Integer> entry : entries) {
            if (keywords.size() >= maxCount) {
                break;
            }
            keywords.add(entry.getKey());
        }
        return keywords;
    }

    private boolean isNumeric(String token) {
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
