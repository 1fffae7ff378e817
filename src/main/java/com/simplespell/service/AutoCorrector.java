package com.simplespell.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites a text block, replacing every unknown word with its most likely correction.
 *
 * <p>Corrections are written in lowercase except where the replaced occurrence started with
 * an uppercase letter, in which case the correction gets an initial capital too.</p>
 *
 * <p>By default occurrences are matched as case-insensitive substrings, so a suspected word
 * is also replaced where it appears inside a longer word. With {@code wholeWords} set, only
 * occurrences not touching another letter are replaced. Corrections are applied one suspected
 * word at a time to the already corrected text, so an earlier correction can create or remove
 * matches for a later one.</p>
 */
@Service
public class AutoCorrector {

    private final TextChecker checker;
    private final boolean wholeWords;

    @Autowired
    public AutoCorrector(TextChecker checker,
                         @Value("${spellcheck.autocorrect.whole-words:false}") boolean wholeWords) {
        this.checker = checker;
        this.wholeWords = wholeWords;
    }

    /**
     * @throws IllegalArgumentException if the text is null
     */
    public String autoCorrect(String text) {
        // the items are fixed against the original text before any rewriting
        List<SpellCheckItem> items = checker.check(text);
        String corrected = text;
        for (SpellCheckItem item : items) {
            if (!item.hasSuggestions()) continue;
            corrected = replace(corrected, item.getSuspectedWord(), item.topSuggestion());
        }
        return corrected;
    }

    private String replace(String text, String suspect, String replacement) {
        Matcher m = occurrences(suspect).matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        while (m.find()) {
            out.append(text, last, m.start());
            if (Character.isUpperCase(text.charAt(m.start()))) {
                out.append(Character.toUpperCase(replacement.charAt(0))).append(replacement, 1, replacement.length());
            } else {
                out.append(replacement);
            }
            last = m.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    private Pattern occurrences(String suspect) {
        String quoted = Pattern.quote(suspect);
        if (wholeWords) quoted = "(?<![A-Za-z])" + quoted + "(?![A-Za-z])";
        return Pattern.compile(quoted, Pattern.CASE_INSENSITIVE);
    }

    public boolean isWholeWords() {
        return wholeWords;
    }
}
