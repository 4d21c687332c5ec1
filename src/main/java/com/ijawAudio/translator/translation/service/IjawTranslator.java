package com.ijawAudio.translator.translation.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ijawAudio.translator.grammar.service.GrammarEngine;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.service.LexiconSnapshot;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;
import com.ijawAudio.translator.translation.model.TranslationResult;
import com.ijawAudio.translator.translation.model.TranslationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ijaw Translator service - translates English text to Ijaw.
 *
 * Responsibilities:
 * - Return the phrase dictionary value for an exact full-phrase match
 * - Otherwise ask the grammar engine for a rule-based rendering
 * - Fall back to per-word dictionary lookup when the engine fails or echoes the input
 * - Cache results per lexicon snapshot, so an entry computed before a dictionary change is never served after it
 */
@Slf4j
@Service
public class IjawTranslator {

    private final Lexicon lexicon;
    private final GrammarEngine grammarEngine;
    private final Cache<String, CachedTranslation> translationCache;

    public IjawTranslator(Lexicon lexicon,
                          GrammarEngine grammarEngine,
                          @Value("${translator.cache.max-size:10000}") long cacheMaxSize,
                          @Value("${translator.cache.ttl-minutes:30}") long cacheTtlMinutes) {
        this.lexicon = lexicon;
        this.grammarEngine = grammarEngine;
        this.translationCache = Caffeine.newBuilder()
                .maximumSize(cacheMaxSize)
                .expireAfterAccess(Duration.ofMinutes(cacheTtlMinutes))
                .build();
    }

    /**
     * Translates English text to Ijaw.
     *
     * @param englishText English text, as typed or transcribed
     * @param correlationId Correlation ID for logging and tracking
     * @return TranslationResult with the Ijaw text and the strategy that produced it
     */
    public TranslationResult translate(String englishText, String correlationId) {
        String key = TextNormalizer.strip(englishText);
        if (key.isEmpty()) {
            log.warn("Empty English text provided for translation - correlationId: {}", correlationId);
            return TranslationResult.builder()
                    .originalText(englishText)
                    .translatedText("")
                    .strategy(TranslationStrategy.NONE)
                    .build();
        }

        LexiconSnapshot snapshot = lexicon.snapshot();
        CachedTranslation cached = translationCache.getIfPresent(key);
        if (cached != null && cached.snapshot() == snapshot) {
            log.debug("Translation served from cache - correlationId: {}", correlationId);
            return cached.result();
        }

        TranslationResult result = translateUncached(key, snapshot, correlationId);
        translationCache.put(key, new CachedTranslation(snapshot, result));
        log.info("Translation completed - correlationId: {}, strategy: {}, original length: {}, translated length: {}",
                correlationId, result.getStrategy(), key.length(), result.getTranslatedText().length());
        return result;
    }

    /**
     * Drops every cached translation. Called whenever the phrase dictionary changes; entries
     * computed against an older snapshot are ignored on lookup even if they are stored afterwards.
     */
    public void invalidateCache() {
        translationCache.invalidateAll();
        log.debug("Translation cache invalidated");
    }

    private TranslationResult translateUncached(String text, LexiconSnapshot snapshot, String correlationId) {
        String normalized = TextNormalizer.normalize(text);

        String phrase = snapshot.lookupPhrase(normalized).orElse(null);
        if (phrase != null) {
            return result(text, phrase, TranslationStrategy.PHRASE_DICTIONARY);
        }

        try {
            String generated = grammarEngine.generateTranslation(text);
            if (generated != null && !generated.isBlank() && !generated.equals(text)) {
                return result(text, generated, TranslationStrategy.GRAMMAR);
            }
        } catch (RuntimeException e) {
            log.warn("Grammar engine translation failed - correlationId: {}, error: {}", correlationId, e.getMessage(), e);
        }

        return result(text, translateWordByWord(normalized, snapshot), TranslationStrategy.WORD_BY_WORD);
    }

    private String translateWordByWord(String normalized, LexiconSnapshot snapshot) {
        List<String> translatedWords = new ArrayList<>();
        for (String word : TextNormalizer.tokenize(normalized)) {
            String cleanWord = TextNormalizer.stripPunctuation(word);
            translatedWords.add(snapshot.lookupPhrase(cleanWord).orElse(word));
        }
        return String.join(" ", translatedWords);
    }

    private TranslationResult result(String original, String translated, TranslationStrategy strategy) {
        return TranslationResult.builder()
                .originalText(original)
                .translatedText(translated)
                .strategy(strategy)
                .build();
    }

    private record CachedTranslation(LexiconSnapshot snapshot, TranslationResult result) {}
}
