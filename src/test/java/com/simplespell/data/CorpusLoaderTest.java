package com.simplespell.data;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.simplespell.service.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusLoaderTest {

    private FrequencyModel model;
    private SpellChecker spellChecker;

    @BeforeEach
    void setUp() {
        model = new FrequencyModel();
        SuggestionSearch search = new SuggestionSearch(model, new CandidateGenerator());
        TextChecker checker = new TextChecker(model, search);
        spellChecker = new SpellChecker(model, search, checker, new AutoCorrector(checker, false),
                Caffeine.newBuilder().<String, List<String>>build(), new SimpleMeterRegistry());
    }

    private CorpusLoader loader(String location) {
        return new CorpusLoader(new DefaultResourceLoader(), spellChecker, location);
    }

    @Test
    void loadsClasspathCorpusOnStartup() {
        loader("classpath:test-corpus.txt").run();
        assertEquals(4, model.size());
        assertEquals(3, model.frequency("the"));
    }

    @Test
    void loadsFileCorpus(@TempDir Path dir) throws IOException {
        Path corpus = dir.resolve("corpus.txt");
        Files.write(corpus, "Zürich zebra zebra".getBytes(StandardCharsets.UTF_8));
        loader("").load(corpus.toUri().toString());
        assertEquals(2, model.frequency("zebra"));
        assertTrue(model.isKnown("rich"));
    }

    @Test
    void blankLocationSkipsStartupBuild() {
        loader(" ").run();
        assertFalse(model.isInitialized());
    }

    @Test
    void missingCorpusFailsAndKeepsPreviousModel() {
        CorpusLoader loader = loader("classpath:test-corpus.txt");
        loader.run();
        CorpusLoadException e = assertThrows(CorpusLoadException.class,
                () -> loader.load("classpath:no-such-corpus.txt"));
        assertEquals("classpath:no-such-corpus.txt", e.getLocation());
        assertNotNull(e.getCause());
        assertEquals(3, model.frequency("the"));
    }

    @Test
    void missingCorpusBeforeAnyBuildLeavesModelUninitialized() {
        assertThrows(CorpusLoadException.class, () -> loader("classpath:no-such-corpus.txt").run());
        assertFalse(model.isInitialized());
    }
}
