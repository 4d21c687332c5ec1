package com.ijawAudio.translator.lexicon.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ijawAudio.translator.lexicon.exception.InvalidLexiconException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Utility class for reading and writing flat English to Ijaw dictionary files.
 * A dictionary file is a single JSON object whose values are all strings.
 * Files can be read from the filesystem or from the classpath.
 */
public class DictionaryFileLoader {

    private static final Logger log = LoggerFactory.getLogger(DictionaryFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private DictionaryFileLoader() {}

    /**
     * Loads a dictionary file from the filesystem.
     *
     * @param path Path of the JSON file
     * @return Entries in file order
     * @throws IOException if the file cannot be read
     * @throws InvalidLexiconException if the content is not a JSON object of strings
     */
    public static Map<String, String> loadFromFile(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    /**
     * Loads a dictionary file from the classpath.
     *
     * @param resourcePath The path to the JSON file (e.g., "dictionaries/en_to_ijaw.json")
     * @return Entries in file order
     * @throws IOException if the resource cannot be read or doesn't exist
     * @throws InvalidLexiconException if the content is not a JSON object of strings
     */
    public static Map<String, String> loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream inputStream = DictionaryFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return parse(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), "classpath:" + resourcePath);
        }
    }

    /**
     * Loads an optional dictionary file, returning an empty map if it is missing or unreadable.
     * Useful for report-only data such as the audio mapping.
     *
     * @param path Path of the JSON file
     * @return Entries, or an empty map
     */
    public static Map<String, String> loadOrEmpty(Path path) {
        if (!Files.exists(path)) {
            log.warn("Dictionary file not found at {}", path);
            return Map.of();
        }
        try {
            return loadFromFile(path);
        } catch (IOException | InvalidLexiconException e) {
            log.warn("Failed to load dictionary file: {}", path, e);
            return Map.of();
        }
    }

    /**
     * Writes the entries as pretty-printed UTF-8 JSON sorted by English key, creating parent directories.
     *
     * @param path Target file
     * @param entries Dictionary entries
     * @throws IOException if the file cannot be written
     */
    public static void save(Path path, Map<String, String> entries) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writeValueAsString(new TreeMap<>(entries));
        Files.writeString(path, json, StandardCharsets.UTF_8);
    }

    static Map<String, String> parse(String json, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidLexiconException("Dictionary " + source + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidLexiconException("Dictionary " + source + " must be a JSON object of English to Ijaw strings");
        }

        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new InvalidLexiconException("Dictionary " + source + " entry '" + field.getKey()
                        + "' must map to a string, got " + field.getValue().getNodeType());
            }
            entries.put(field.getKey(), field.getValue().asText());
        }
        return entries;
    }
}
