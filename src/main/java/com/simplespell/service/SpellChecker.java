package com.simplespell.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.simplespell.data.FrequencyModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Entry point of the spell checker: builds the corpus and answers known-word, suggestion,
 * check and auto-correct requests against it.
 *
 * <p>This class is useless until a corpus has been built; every query before that throws
 * {@link com.simplespell.data.NotInitializedException}. Any language written in the plain
 * Roman alphabet works once its corpus is loaded, but substitutions and insertions only use
 * the letters a-z.</p>
 */
@Service
public class SpellChecker {

    private static final Logger log = LoggerFactory.getLogger(SpellChecker.class);

    private final FrequencyModel model;
    private final SuggestionSearch search;
    private final TextChecker checker;
    private final AutoCorrector corrector;
    private final Cache<String, List<String>> suggestionCache;
    private final MeterRegistry meterRegistry;

    @Autowired
    public SpellChecker(FrequencyModel model,
                        SuggestionSearch search,
                        TextChecker checker,
                        AutoCorrector corrector,
                        @Qualifier("suggestionCache") Cache<String, List<String>> suggestionCache,
                        MeterRegistry meterRegistry) {
        this.model = model;
        this.search = search;
        this.checker = checker;
        this.corrector = corrector;
        this.suggestionCache = suggestionCache;
        this.meterRegistry = meterRegistry;
    }

    /** Replaces the corpus with the words of the given sample text. */
    public void buildCorpus(String text) {
        model.build(text);
        suggestionCache.invalidateAll();
        count("build");
    }

    public Set<String> findKnownWords(Collection<String> words) {
        count("known");
        return model.filterKnown(words);
    }

    public Set<String> findUnknownWords(Collection<String> words) {
        count("unknown");
        return model.filterUnknown(words);
    }

    /**
     * Alternatives for a possibly misspelled word, in likelihood order based on frequency
     * of use in the corpus.
     *
     * @throws IllegalArgumentException if the word is null
     */
    public List<String> suggestAlternatives(String word) {
        count("suggest");
        long generation = model.generation();
        if (word == null) throw new IllegalArgumentException("Word must not be null");
        String key = generation + ":" + word.toLowerCase(Locale.ROOT);
        List<String> cached = suggestionCache.getIfPresent(key);
        if (cached != null) {
            meterRegistry.counter("spellcheck.suggest.cache", "result", "hit").increment();
            return cached;
        }
        meterRegistry.counter("spellcheck.suggest.cache", "result", "miss").increment();
        Timer.Sample sample = Timer.start(meterRegistry);
        List<String> suggestions = search.suggest(word);
        sample.stop(meterRegistry.timer("spellcheck.suggest.latency"));
        suggestionCache.put(key, suggestions);
        log.debug("Suggestions for '{}': {}", word, suggestions);
        return suggestions;
    }

    /** {@link #suggestAlternatives(String)} with the corpus frequency of each suggestion. */
    public List<Suggestion> rankedSuggestions(String word) {
        Map<String, Integer> table = model.asMap();
        return suggestAlternatives(word).stream()
                .map(w -> new Suggestion(w, table.getOrDefault(w, 0)))
                .collect(Collectors.toList());
    }

    public List<SpellCheckItem> check(String text) {
        count("check");
        List<SpellCheckItem> items = checker.check(text);
        log.debug("Check found {} suspected words", items.size());
        return items;
    }

    public String autoCorrect(String text) {
        count("autocorrect");
        return corrector.autoCorrect(text);
    }

    /** The most frequent corpus words, ties in lexicographic order. */
    public List<String> topWords(int limit) {
        Map<String, Integer> table = model.asMap();
        return table.keySet().stream()
                .sorted(SuggestionSearch.byFrequency(table))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public int vocabularySize() {
        return model.size();
    }

    public long corpusTokenCount() {
        return model.tokenCount();
    }

    public boolean isCorpusBuilt() {
        return model.isInitialized();
    }

    private void count(String op) {
        meterRegistry.counter("spellcheck.requests", "op", op).increment();
    }
}
