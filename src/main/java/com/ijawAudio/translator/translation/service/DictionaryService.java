package com.ijawAudio.translator.translation.service;

import com.ijawAudio.translator.lexicon.model.PhraseDictionary;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.util.DictionaryFileLoader;
import com.ijawAudio.translator.lexicon.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Dictionary service - manages the phrase dictionary behind the translator.
 *
 * Responsibilities:
 * - Expose the current phrase dictionary and the optional audio mapping
 * - Persist the dictionary file on every change
 * - Publish a new lexicon snapshot once the file is written
 * - Invalidate cached translations when the dictionary changes
 */
@Slf4j
@Service
public class DictionaryService {

    private final Lexicon lexicon;
    private final IjawTranslator ijawTranslator;
    private final Path dictionaryPath;
    private final Map<String, String> audioEntries;

    public DictionaryService(Lexicon lexicon,
                             IjawTranslator ijawTranslator,
                             @Value("${translator.dictionary.path:dictionaries/en_to_ijaw.json}") String dictionaryPath,
                             @Value("${translator.dictionary.audio-path:dictionaries/audio_dict.json}") String audioPath) {
        this.lexicon = lexicon;
        this.ijawTranslator = ijawTranslator;
        this.dictionaryPath = Paths.get(dictionaryPath);
        this.audioEntries = DictionaryFileLoader.loadOrEmpty(Paths.get(audioPath));
        log.info("Loaded {} audio mappings", audioEntries.size());
    }

    /**
     * Read-only view of the current phrase dictionary.
     */
    public Map<String, String> entries() {
        return lexicon.snapshot().phraseDictionary().asMap();
    }

    public Map<String, String> audioEntries() {
        return audioEntries;
    }

    public int size() {
        return lexicon.snapshot().phraseDictionary().size();
    }

    /**
     * Adds a translation and writes the dictionary file.
     *
     * @param englishWord English word or phrase (stored lower-cased)
     * @param ijawWord Ijaw translation
     * @throws IllegalArgumentException if either argument is blank
     * @throws UncheckedIOException if the dictionary file cannot be written
     */
    public synchronized void addTranslation(String englishWord, String ijawWord) {
        if (TextNormalizer.strip(englishWord).isEmpty() || TextNormalizer.strip(ijawWord).isEmpty()) {
            throw new IllegalArgumentException("english_word and ijaw_word must not be blank");
        }
        String key = TextNormalizer.normalize(englishWord);
        String value = TextNormalizer.strip(ijawWord);
        PhraseDictionary updated = lexicon.snapshot().phraseDictionary().with(key, value);

        try {
            DictionaryFileLoader.save(dictionaryPath, updated.asMap());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save dictionary to " + dictionaryPath, e);
        }

        lexicon.publish(updated);
        ijawTranslator.invalidateCache();
        log.info("Added translation: {} -> {}", key, value);
    }
}
