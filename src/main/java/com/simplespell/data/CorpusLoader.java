package com.simplespell.data;

import com.simplespell.service.SpellChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads a plain-text corpus file and builds the spell checker from it.
 *
 * <p>The location is a Spring resource location such as {@code classpath:corpus.txt} or
 * {@code file:/data/corpus.txt}. The whole file is held in memory while it is counted.</p>
 */
@Component
public class CorpusLoader implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

    private final ResourceLoader resourceLoader;
    private final SpellChecker spellChecker;
    private final String defaultLocation;

    public CorpusLoader(ResourceLoader resourceLoader,
                        SpellChecker spellChecker,
                        @Value("${spellcheck.corpus:classpath:corpus.txt}") String defaultLocation) {
        this.resourceLoader = resourceLoader;
        this.spellChecker = spellChecker;
        this.defaultLocation = defaultLocation;
    }

    @Override
    public void run(String... args) {
        if (defaultLocation == null || defaultLocation.isBlank()) {
            log.info("No corpus location configured, skipping startup corpus build");
            return;
        }
        load(defaultLocation);
    }

    public void loadDefault() {
        load(defaultLocation);
    }

    /**
     * Reads the corpus at the location and rebuilds the spell checker from it.
     *
     * @throws CorpusLoadException if the corpus cannot be read; the current corpus is kept
     */
    public void load(String location) {
        String text = read(location);
        spellChecker.buildCorpus(text);
        log.info("Loaded corpus from {}", location);
    }

    private String read(String location) {
        if (location == null || location.isBlank())
            throw new CorpusLoadException(String.valueOf(location), new IOException("No corpus location given"));
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Could not read corpus from {}", location, e);
            throw new CorpusLoadException(location, e);
        }
    }

    public String getDefaultLocation() {
        return defaultLocation;
    }
}
