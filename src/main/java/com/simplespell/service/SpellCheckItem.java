package com.simplespell.service;

import java.util.List;
import java.util.Objects;

/**
 * A suspected misspelling found in a text block, with its suggested replacements
 * ordered from most to least frequent in the corpus.
 */
public final class SpellCheckItem {

    private final String suspectedWord;
    private final List<String> suggestedAlternatives;

    public SpellCheckItem(String suspectedWord, List<String> suggestedAlternatives) {
        this.suspectedWord = Objects.requireNonNull(suspectedWord, "suspectedWord");
        this.suggestedAlternatives = List.copyOf(suggestedAlternatives);
    }

    public String getSuspectedWord() {
        return suspectedWord;
    }

    public List<String> getSuggestedAlternatives() {
        return suggestedAlternatives;
    }

    public boolean hasSuggestions() {
        return !suggestedAlternatives.isEmpty();
    }

    /** The most likely replacement. Only valid when {@link #hasSuggestions()}. */
    public String topSuggestion() {
        return suggestedAlternatives.get(0);
    }

    @Override
    public String toString() {
        return "SpellCheckItem{" +
                "suspectedWord='" + suspectedWord + '\'' +
                ", suggestedAlternatives=" + suggestedAlternatives +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpellCheckItem)) return false;
        SpellCheckItem that = (SpellCheckItem) o;
        return suspectedWord.equals(that.suspectedWord)
                && suggestedAlternatives.equals(that.suggestedAlternatives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(suspectedWord, suggestedAlternatives);
    }
}
