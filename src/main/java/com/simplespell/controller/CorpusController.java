package com.simplespell.controller;

import com.simplespell.data.CorpusLoader;
import com.simplespell.service.SpellChecker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rebuilds the corpus at runtime, either from posted text or from a resource location.
 */
@RestController
@RequestMapping("/api/corpus")
public class CorpusController {

    private final SpellChecker spellChecker;
    private final CorpusLoader corpusLoader;

    @Autowired
    public CorpusController(SpellChecker spellChecker, CorpusLoader corpusLoader) {
        this.spellChecker = spellChecker;
        this.corpusLoader = corpusLoader;
    }

    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, Object>> build(@RequestBody(required = false) String text) {
        if (text == null) return ResponseEntity.badRequest().build();
        spellChecker.buildCorpus(text);
        return ResponseEntity.ok(summary());
    }

    @PostMapping("/reload")
    public ResponseEntity<Map<String, Object>> reload(@RequestParam(value = "location", required = false) String location) {
        if (location == null || location.isBlank()) corpusLoader.loadDefault();
        else corpusLoader.load(location);
        return ResponseEntity.ok(summary());
    }

    private Map<String, Object> summary() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("vocabularySize", spellChecker.vocabularySize());
        m.put("corpusTokens", spellChecker.corpusTokenCount());
        return m;
    }
}
