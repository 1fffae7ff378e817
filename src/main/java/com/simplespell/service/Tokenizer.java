package com.simplespell.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slices text into lowercase words made of the letters a-z only.
 * Digits, punctuation and accented letters act as separators.
 */
public final class Tokenizer {

    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

    private Tokenizer() {}

    /**
     * Returns every word of the text in order of appearance.
     * Repeats are kept, callers that need distinct words deduplicate themselves.
     */
    public static List<String> extractWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isEmpty()) return words;
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            words.add(m.group().toLowerCase(Locale.ROOT));
        }
        return words;
    }
}
