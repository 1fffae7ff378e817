package com.simplespell.service;

import com.simplespell.data.FrequencyModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the words of a text block that are not in the corpus and pairs each with its
 * suggested alternatives.
 *
 * <p>Searching two edits away costs time and memory that grow with the square of the word
 * length. Unknown words longer than {@code maxWordLength} are still reported, but without
 * suggestions and without being searched. A bound of 0 searches every word.</p>
 */
@Service
public class TextChecker {

    private final FrequencyModel model;
    private final SuggestionSearch search;
    private final int maxWordLength;

    public TextChecker(FrequencyModel model, SuggestionSearch search) {
        this(model, search, 0);
    }

    @Autowired
    public TextChecker(FrequencyModel model,
                       SuggestionSearch search,
                       @Value("${spellcheck.max-word-length:40}") int maxWordLength) {
        if (maxWordLength < 0) throw new IllegalArgumentException("max-word-length must not be negative");
        this.model = model;
        this.search = search;
        this.maxWordLength = maxWordLength;
    }

    /**
     * @return one item per distinct unknown word, in order of first appearance
     * @throws IllegalArgumentException if the text is null
     */
    public List<SpellCheckItem> check(String text) {
        model.checkInitialized();
        if (text == null) throw new IllegalArgumentException("Text must not be null");
        List<SpellCheckItem> items = new ArrayList<>();
        for (String word : model.filterUnknown(Tokenizer.extractWords(text))) {
            List<String> suggestions = isSearchable(word) ? search.suggest(word) : Collections.emptyList();
            items.add(new SpellCheckItem(word, suggestions));
        }
        return items;
    }

    private boolean isSearchable(String word) {
        return maxWordLength == 0 || word.length() <= maxWordLength;
    }

    public int getMaxWordLength() {
        return maxWordLength;
    }
}
