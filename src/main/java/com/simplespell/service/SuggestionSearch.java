package com.simplespell.service;

import com.simplespell.data.FrequencyModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Finds the known words nearest to a word, searching one edit away first and two edits
 * away only when the first pass finds nothing.
 */
@Service
public class SuggestionSearch {

    private final FrequencyModel model;
    private final CandidateGenerator generator;

    @Autowired
    public SuggestionSearch(FrequencyModel model, CandidateGenerator generator) {
        this.model = model;
        this.generator = generator;
    }

    /**
     * Suggests alternatives for a possibly misspelled word.
     *
     * @return the lowercase word alone if it is known; otherwise the known words within one
     * edit, or failing that within two edits, most frequent first. Empty when nothing is
     * within two edits. Some misspellings are dictionary words themselves and come back as known.
     * @throws IllegalArgumentException if the word is null
     */
    public List<String> suggest(String word) {
        // one snapshot for the whole search, so a concurrent rebuild cannot mix tables
        Map<String, Integer> table = model.asMap();
        if (word == null) throw new IllegalArgumentException("Word must not be null");
        String lower = word.toLowerCase(Locale.ROOT);
        if (table.containsKey(lower)) return Collections.singletonList(lower);

        Set<String> firstGeneration = generator.generate(lower);
        Set<String> known = new LinkedHashSet<>();
        for (String candidate : firstGeneration) {
            if (table.containsKey(candidate)) known.add(candidate);
        }
        if (!known.isEmpty()) return rank(known, table);

        // expand every first-generation candidate, known or not; only known words are kept
        for (String candidate : firstGeneration) {
            generator.forEachCandidate(candidate, c -> {
                if (table.containsKey(c)) known.add(c);
            });
        }
        if (!known.isEmpty()) return rank(known, table);

        return Collections.emptyList();
    }

    private static List<String> rank(Set<String> known, Map<String, Integer> table) {
        List<String> ranked = new ArrayList<>(known);
        ranked.sort(byFrequency(table));
        return Collections.unmodifiableList(ranked);
    }

    /** Most frequent first, equal counts in ascending lexicographic order. */
    static Comparator<String> byFrequency(Map<String, Integer> table) {
        return Comparator.comparingInt((String w) -> table.getOrDefault(w, 0)).reversed()
                .thenComparing(Comparator.naturalOrder());
    }
}
