package com.ijawAudio.translator.config;

import com.ijawAudio.translator.lexicon.exception.InvalidLexiconException;
import com.ijawAudio.translator.lexicon.service.Lexicon;
import com.ijawAudio.translator.lexicon.util.DictionaryFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads the phrase dictionary once at start-up and exposes the lexicon bean.
 *
 * Lookup order: the configured filesystem path, then the bundled classpath copy, then an empty
 * dictionary. A dictionary that exists but is malformed aborts start-up.
 */
@Slf4j
@Configuration
public class LexiconConfig {

    static final String BUNDLED_DICTIONARY = "dictionaries/en_to_ijaw.json";

    @Bean
    public Lexicon lexicon(@Value("${translator.dictionary.path:dictionaries/en_to_ijaw.json}") String dictionaryPath) {
        return Lexicon.load(loadPhraseDictionary(Paths.get(dictionaryPath)));
    }

    static Map<String, String> loadPhraseDictionary(Path dictionaryPath) {
        if (Files.exists(dictionaryPath)) {
            try {
                Map<String, String> entries = DictionaryFileLoader.loadFromFile(dictionaryPath);
                log.info("Loaded {} translations from {}", entries.size(), dictionaryPath);
                return entries;
            } catch (IOException e) {
                throw new InvalidLexiconException("Dictionary file " + dictionaryPath + " could not be read", e);
            }
        }

        log.warn("Dictionary not found at {}, using bundled classpath copy", dictionaryPath);
        try {
            Map<String, String> entries = DictionaryFileLoader.loadFromClasspath(BUNDLED_DICTIONARY);
            log.info("Loaded {} translations from classpath:{}", entries.size(), BUNDLED_DICTIONARY);
            return entries;
        } catch (IOException e) {
            log.warn("Bundled dictionary unavailable, starting with an empty phrase dictionary: {}", e.getMessage());
            return Map.of();
        }
    }
}
