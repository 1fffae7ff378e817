package com.simplespell.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Generates every string one edit away from a word.
 *
 * <p>Possible misspellings are missing letters (today -> tday), swapped neighbours
 * (the -> teh), wrong letters (date -> dzte) and extra letters (date -> dzate). The word
 * is cut at every position into a left and a right part and each edit is applied at the
 * head of the right part, so "date" is cut into ("", "date"), ("d", "ate"), ("da", "te"),
 * ("dat", "e") and ("date", "").</p>
 *
 * <p>The result keeps a fixed order: deletions, then transpositions, then substitutions
 * (alphabet order, then cut position), then insertions (same order). Duplicates are
 * dropped on first sight.</p>
 */
@Component
public class CandidateGenerator {

    public static final String DEFAULT_ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private final char[] alphabet;

    public CandidateGenerator() {
        this(DEFAULT_ALPHABET);
    }

    /**
     * @param alphabet distinct letters a-z used for substitutions and insertions.
     *                 Leaving letters out restricts the search and is a deliberate choice.
     */
    @Autowired
    public CandidateGenerator(@Value("${spellcheck.alphabet:" + DEFAULT_ALPHABET + "}") String alphabet) {
        this.alphabet = validate(alphabet);
    }

    public String getAlphabet() {
        return new String(alphabet);
    }

    public Set<String> generate(String word) {
        if (word == null) return Collections.emptySet();
        Set<String> out = new LinkedHashSet<>();
        forEachCandidate(word, out::add);
        return out;
    }

    /**
     * Hands every candidate to the sink in {@link #generate(String)} order, without collecting
     * or deduplicating them.
     */
    public void forEachCandidate(String word, Consumer<String> sink) {
        int n = word.length();
        // deletions
        for (int i = 0; i < n; i++) {
            sink.accept(word.substring(0, i) + word.substring(i + 1));
        }
        // transpositions of the first two letters of the right part
        for (int i = 0; i + 1 < n; i++) {
            sink.accept(word.substring(0, i) + word.charAt(i + 1) + word.charAt(i) + word.substring(i + 2));
        }
        // substitutions
        for (char c : alphabet) {
            for (int i = 0; i < n; i++) {
                sink.accept(word.substring(0, i) + c + word.substring(i + 1));
            }
        }
        // insertions, including after the last letter
        for (char c : alphabet) {
            for (int i = 0; i <= n; i++) {
                sink.accept(word.substring(0, i) + c + word.substring(i));
            }
        }
    }

    private static char[] validate(String alphabet) {
        if (alphabet == null || alphabet.isEmpty())
            throw new IllegalArgumentException("Alphabet must not be empty");
        Set<Character> seen = new LinkedHashSet<>();
        for (char c : alphabet.toCharArray()) {
            if (c < 'a' || c > 'z')
                throw new IllegalArgumentException("Alphabet may only contain the letters a-z: " + alphabet);
            if (!seen.add(c))
                throw new IllegalArgumentException("Duplicate letter '" + c + "' in alphabet: " + alphabet);
        }
        return alphabet.toCharArray();
    }
}
