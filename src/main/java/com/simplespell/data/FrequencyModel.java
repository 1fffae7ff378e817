package com.simplespell.data;

import com.simplespell.service.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Table of corpus words and their occurrence counts.
 *
 * <p>The table is an immutable snapshot held behind a single reference. {@link #build(String)}
 * swaps in a complete new snapshot, so concurrent readers see either the old table or the
 * new one, never a partial one. A failed build leaves the previous snapshot in place.</p>
 */
@Service
public class FrequencyModel {

    private static final Logger log = LoggerFactory.getLogger(FrequencyModel.class);

    private static final class Snapshot {
        final Map<String, Integer> counts;
        final long tokens;
        final long generation;

        Snapshot(Map<String, Integer> counts, long tokens, long generation) {
            this.counts = counts;
            this.tokens = tokens;
            this.generation = generation;
        }
    }

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public FrequencyModel() {}

    /**
     * Tokenizes the text and replaces the whole table with the counts found in it.
     * Building twice from the same text yields the same table.
     */
    public void build(String text) {
        if (text == null) throw new IllegalArgumentException("Corpus text must not be null");
        List<String> words = Tokenizer.extractWords(text);
        Map<String, Integer> counts = new HashMap<>();
        for (String w : words) {
            counts.merge(w, 1, Integer::sum);
        }
        Map<String, Integer> table = Collections.unmodifiableMap(counts);
        Snapshot built = snapshot.updateAndGet(prev ->
                new Snapshot(table, words.size(), prev == null ? 1L : prev.generation + 1));
        log.info("Built frequency model: {} distinct words from {} tokens (generation {})",
                table.size(), words.size(), built.generation);
    }

    public boolean isInitialized() {
        return snapshot.get() != null;
    }

    /**
     * @throws NotInitializedException if no corpus has been built yet
     */
    public void checkInitialized() {
        current();
    }

    public boolean isKnown(String word) {
        Map<String, Integer> counts = current().counts;
        return word != null && counts.containsKey(normalize(word));
    }

    /**
     * Corpus count of a known word. Guard with {@link #isKnown(String)} first.
     *
     * @throws IllegalArgumentException if the word is not in the corpus
     */
    public int frequency(String word) {
        Integer count = word == null ? null : current().counts.get(normalize(word));
        if (count == null) throw new IllegalArgumentException("Unknown word: " + word);
        return count;
    }

    /** Distinct lowercase forms of the known words, in first-occurrence order. */
    public Set<String> filterKnown(Collection<String> words) {
        return filter(words, true);
    }

    /** Distinct lowercase forms of the unknown words, in first-occurrence order. */
    public Set<String> filterUnknown(Collection<String> words) {
        return filter(words, false);
    }

    private Set<String> filter(Collection<String> words, boolean known) {
        Map<String, Integer> counts = current().counts;
        Set<String> out = new LinkedHashSet<>();
        for (String w : words) {
            if (w == null) continue;
            String lower = normalize(w);
            if (counts.containsKey(lower) == known) out.add(lower);
        }
        return out;
    }

    public int size() {
        return current().counts.size();
    }

    /** Number of word tokens the current table was counted from. */
    public long tokenCount() {
        return current().tokens;
    }

    /** Incremented by every successful build, starting at 1. */
    public long generation() {
        return current().generation;
    }

    /** Read-only view of the current table. */
    public Map<String, Integer> asMap() {
        return current().counts;
    }

    private Snapshot current() {
        Snapshot s = snapshot.get();
        if (s == null) throw new NotInitializedException();
        return s;
    }

    private static String normalize(String word) {
        return word.toLowerCase(Locale.ROOT);
    }
}
