package com.ijawAudio.translator.lexicon.model;

import com.ijawAudio.translator.lexicon.exception.InvalidLexiconException;
import com.ijawAudio.translator.lexicon.service.LexiconSource;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the flat English phrase to Ijaw dictionary.
 *
 * Keys are normalized (trimmed, lower-cased) on construction, so lookups are case-insensitive
 * and may span several words. Updates never modify a snapshot; {@link #with(String, String)}
 * returns a new one.
 */
public final class PhraseDictionary implements LexiconSource {

    private static final PhraseDictionary EMPTY = new PhraseDictionary(Map.of());

    private final Map<String, String> phrases;

    private PhraseDictionary(Map<String, String> normalized) {
        this.phrases = Collections.unmodifiableMap(normalized);
    }

    public static PhraseDictionary empty() {
        return EMPTY;
    }

    /**
     * Builds a snapshot from raw key/value data.
     *
     * @param raw English phrase to Ijaw text
     * @return Normalized snapshot
     * @throws InvalidLexiconException if the mapping is null, or holds a blank key or a null value
     */
    public static PhraseDictionary of(Map<String, String> raw) {
        if (raw == null) {
            throw new InvalidLexiconException("Phrase dictionary must be a key/value mapping, got null");
        }
        Map<String, String> normalized = new HashMap<>(raw.size() * 2);
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            String key = TextNormalizer.normalize(entry.getKey());
            if (key.isEmpty()) {
                throw new InvalidLexiconException("Phrase dictionary contains a blank English key");
            }
            if (entry.getValue() == null) {
                throw new InvalidLexiconException("Phrase dictionary entry '" + key + "' has no Ijaw value");
            }
            normalized.put(key, entry.getValue());
        }
        return new PhraseDictionary(normalized);
    }

    /**
     * Returns a new snapshot with the entry added or replaced.
     */
    public PhraseDictionary with(String english, String ijaw) {
        Map<String, String> copy = new HashMap<>(phrases);
        copy.put(english, ijaw);
        return of(copy);
    }

    public int size() {
        return phrases.size();
    }

    /**
     * Read-only view of the normalized entries.
     */
    public Map<String, String> asMap() {
        return phrases;
    }

    @Override
    public String name() {
        return "phrase-dictionary";
    }

    @Override
    public Optional<String> lookup(String text) {
        return Optional.ofNullable(phrases.get(TextNormalizer.normalize(text)));
    }
}
