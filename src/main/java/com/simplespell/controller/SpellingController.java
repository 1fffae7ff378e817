package com.simplespell.controller;

import com.simplespell.service.SpellCheckItem;
import com.simplespell.service.SpellChecker;
import com.simplespell.service.Suggestion;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api")
public class SpellingController {

    private final SpellChecker spellChecker;
    private final MeterRegistry meterRegistry;
    private final int maxWordLength;

    @Autowired
    public SpellingController(SpellChecker spellChecker,
                              MeterRegistry meterRegistry,
                              @Value("${spellcheck.max-word-length:40}") int maxWordLength) {
        this.spellChecker = spellChecker;
        this.meterRegistry = meterRegistry;
        this.maxWordLength = maxWordLength;
    }

    @GetMapping("/spellcheck")
    public ResponseEntity<List<Suggestion>> spellcheck(@RequestParam("word") String word) {
        if (word == null || word.isBlank()) return ResponseEntity.badRequest().build();
        // two-generation search cost grows with the square of the word length
        if (maxWordLength > 0 && word.trim().length() > maxWordLength) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellChecker.rankedSuggestions(word.trim()));
    }

    @PostMapping(value = "/check", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<List<SpellCheckItem>> check(@RequestBody(required = false) String text) {
        return ResponseEntity.ok(spellChecker.check(text == null ? "" : text));
    }

    @PostMapping(value = "/autocorrect", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<CorrectionResponse> autocorrect(@RequestBody(required = false) String text) {
        String original = text == null ? "" : text;
        return ResponseEntity.ok(new CorrectionResponse(original, spellChecker.autoCorrect(original)));
    }

    @PostMapping("/known")
    public ResponseEntity<Set<String>> known(@RequestBody List<String> words) {
        if (words == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellChecker.findKnownWords(words));
    }

    @PostMapping("/unknown")
    public ResponseEntity<Set<String>> unknown(@RequestBody List<String> words) {
        if (words == null) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellChecker.findUnknownWords(words));
    }

    // --- most frequent corpus words ---
    @GetMapping("/trending")
    public ResponseEntity<List<String>> trending(@RequestParam(value = "limit", defaultValue = "10") int limit) {
        if (limit < 0) return ResponseEntity.badRequest().build();
        return ResponseEntity.ok(spellChecker.topWords(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> m = new LinkedHashMap<>();
        boolean built = spellChecker.isCorpusBuilt();
        m.put("corpusBuilt", built);
        m.put("vocabularySize", built ? spellChecker.vocabularySize() : 0);
        m.put("corpusTokens", built ? spellChecker.corpusTokenCount() : 0L);
        double cacheHits = 0.0;
        double cacheMiss = 0.0;
        var ch = meterRegistry.find("spellcheck.suggest.cache").tag("result", "hit").counter();
        if (ch != null) cacheHits = ch.count();
        var cm = meterRegistry.find("spellcheck.suggest.cache").tag("result", "miss").counter();
        if (cm != null) cacheMiss = cm.count();
        m.put("cacheHits", cacheHits);
        m.put("cacheMiss", cacheMiss);
        return ResponseEntity.ok(m);
    }

    // DTOs
    public static class CorrectionResponse {
        private final String original;
        private final String corrected;
        public CorrectionResponse(String original, String corrected) {
            this.original = original; this.corrected = corrected;
        }
        public String getOriginal() { return original; }
        public String getCorrected() { return corrected; }
        public boolean isChanged() { return !original.equals(corrected); }
    }
}
