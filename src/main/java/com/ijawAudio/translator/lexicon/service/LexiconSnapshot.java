package com.ijawAudio.translator.lexicon.service;

import com.ijawAudio.translator.lexicon.model.PhraseDictionary;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the lexicon used for one translation request.
 *
 * Token lookup walks {@link #sources()} in order: the phrase dictionary first (the override layer),
 * then the role tables. A miss returns the token unchanged.
 */
public final class LexiconSnapshot {

    private final PhraseDictionary phraseDictionary;
    private final List<LexiconSource> sources;

    LexiconSnapshot(PhraseDictionary phraseDictionary, List<? extends LexiconSource> roleSources) {
        this.phraseDictionary = phraseDictionary;
        List<LexiconSource> ordered = new ArrayList<>(roleSources.size() + 1);
        ordered.add(phraseDictionary);
        ordered.addAll(roleSources);
        this.sources = List.copyOf(ordered);
    }

    public PhraseDictionary phraseDictionary() {
        return phraseDictionary;
    }

    public List<LexiconSource> sources() {
        return sources;
    }

    /**
     * Looks up a whole phrase in the flat dictionary.
     */
    public Optional<String> lookupPhrase(String phrase) {
        return phraseDictionary.lookup(phrase);
    }

    /**
     * Translates one token through the ordered sources.
     *
     * @param token English token, any casing
     * @return Ijaw rendering, or the token exactly as given if no source knows it
     */
    public String translateToken(String token) {
        if (token == null) {
            return "";
        }
        String key = TextNormalizer.normalize(token);
        for (LexiconSource source : sources) {
            Optional<String> hit = source.lookup(key);
            if (hit.isPresent()) {
                return hit.get();
            }
        }
        return token;
    }
}
