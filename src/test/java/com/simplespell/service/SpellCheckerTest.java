package com.simplespell.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.simplespell.data.FrequencyModel;
import com.simplespell.data.NotInitializedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SpellCheckerTest {

    private static final String CORPUS = "the quick brown fox the the";

    private SimpleMeterRegistry registry;
    private SpellChecker spellChecker;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        spellChecker = create(new FrequencyModel(), registry);
    }

    static SpellChecker create(FrequencyModel model, SimpleMeterRegistry registry) {
        SuggestionSearch search = new SuggestionSearch(model, new CandidateGenerator());
        TextChecker checker = new TextChecker(model, search);
        return new SpellChecker(model, search, checker, new AutoCorrector(checker, false),
                Caffeine.newBuilder().maximumSize(100).<String, List<String>>build(), registry);
    }

    @Test
    void everyQueryFailsBeforeBuild() {
        assertFalse(spellChecker.isCorpusBuilt());
        assertThrows(NotInitializedException.class, () -> spellChecker.suggestAlternatives("teh"));
        assertThrows(NotInitializedException.class, () -> spellChecker.suggestAlternatives(null));
        assertThrows(NotInitializedException.class, () -> spellChecker.check(null));
        assertThrows(NotInitializedException.class, () -> spellChecker.autoCorrect(null));
        assertThrows(NotInitializedException.class, () -> spellChecker.findKnownWords(List.of("the")));
        assertThrows(NotInitializedException.class, () -> spellChecker.findUnknownWords(List.of("the")));
        assertThrows(NotInitializedException.class, () -> spellChecker.check("teh"));
        assertThrows(NotInitializedException.class, () -> spellChecker.autoCorrect("teh"));
        assertThrows(NotInitializedException.class, () -> spellChecker.topWords(3));
    }

    @Test
    void endToEnd() {
        spellChecker.buildCorpus(CORPUS);
        assertEquals(4, spellChecker.vocabularySize());
        assertEquals(6, spellChecker.corpusTokenCount());
        assertEquals(List.of("the"), spellChecker.suggestAlternatives("teh"));
        assertEquals("I saw the fox", spellChecker.autoCorrect("I saw teh fox"));
        assertEquals("The fox", spellChecker.autoCorrect("Teh fox"));
        assertEquals("xzqvt fox", spellChecker.autoCorrect("xzqvt fox"));

        SpellCheckItem teh = spellChecker.check("I saw teh fox").stream()
                .filter(SpellCheckItem::hasSuggestions)
                .findFirst().orElseThrow();
        assertEquals(new SpellCheckItem("teh", List.of("the")), teh);
    }

    @Test
    void nullInputIsRejectedOnceBuilt() {
        spellChecker.buildCorpus(CORPUS);
        assertThrows(IllegalArgumentException.class, () -> spellChecker.suggestAlternatives(null));
        assertThrows(IllegalArgumentException.class, () -> spellChecker.check(null));
        assertThrows(IllegalArgumentException.class, () -> spellChecker.autoCorrect(null));
    }

    @Test
    void knownAndUnknownWords() {
        spellChecker.buildCorpus(CORPUS);
        assertEquals(Set.of("the", "fox"), spellChecker.findKnownWords(List.of("The", "cat", "FOX", "the")));
        assertEquals(Set.of("cat"), spellChecker.findUnknownWords(List.of("The", "cat", "CAT")));
    }

    @Test
    void repeatedSuggestionsComeFromCache() {
        spellChecker.buildCorpus(CORPUS);
        spellChecker.suggestAlternatives("teh");
        spellChecker.suggestAlternatives("TEH");
        assertEquals(1.0, registry.counter("spellcheck.suggest.cache", "result", "miss").count());
        assertEquals(1.0, registry.counter("spellcheck.suggest.cache", "result", "hit").count());
        assertEquals(2.0, registry.counter("spellcheck.requests", "op", "suggest").count());
    }

    @Test
    void rebuildDoesNotServeStaleSuggestions() {
        spellChecker.buildCorpus(CORPUS);
        assertEquals(List.of("the"), spellChecker.suggestAlternatives("teh"));
        spellChecker.buildCorpus("tech");
        assertEquals(List.of("tech"), spellChecker.suggestAlternatives("teh"));
    }

    @Test
    void rankedSuggestionsCarryFrequencies() {
        spellChecker.buildCorpus("cat cat cat bat bat rat hat");
        List<Suggestion> ranked = spellChecker.rankedSuggestions("zat");
        assertEquals(4, ranked.size());
        assertEquals("cat", ranked.get(0).getText());
        assertEquals(3, ranked.get(0).getFrequency());
        assertEquals("bat", ranked.get(1).getText());
        assertEquals(2, ranked.get(1).getFrequency());
    }

    @Test
    void topWordsAreMostFrequentFirst() {
        spellChecker.buildCorpus(CORPUS);
        assertEquals(List.of("the", "brown"), spellChecker.topWords(2));
        assertEquals(4, spellChecker.topWords(10).size());
        assertTrue(spellChecker.topWords(0).isEmpty());
    }

    @Test
    void knownWordsSuggestThemselvesInAnyCase() {
        spellChecker.buildCorpus(CORPUS);
        for (String word : List.of("the", "quick", "brown", "fox")) {
            assertEquals(List.of(word), spellChecker.suggestAlternatives(word.toUpperCase()));
        }
    }
}
