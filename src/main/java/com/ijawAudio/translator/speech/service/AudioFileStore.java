package com.ijawAudio.translator.speech.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;

/**
 * Directory holding generated audio files served by the audio endpoint.
 */
@Slf4j
@Service
public class AudioFileStore {

    private final Path outputDir;

    public AudioFileStore(@Value("${translator.audio.output-dir:output_audio}") String outputDir) {
        this.outputDir = Paths.get(outputDir).toAbsolutePath().normalize();
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Builds a fresh file name, e.g. "tts_en_1a2b3c4d.mp3".
     *
     * @param prefix Name prefix
     * @param extension Extension including the dot
     */
    public String newFileName(String prefix, String extension) {
        return prefix + "_" + UUID.randomUUID().toString().substring(0, 8) + extension;
    }

    /**
     * Writes audio bytes under the given name, creating the directory if needed.
     */
    public Path write(String fileName, byte[] audio) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        Files.write(target, audio);
        log.debug("Audio written - file: {}, bytes: {}", fileName, audio.length);
        return target;
    }

    /**
     * Resolves a stored file. Names that are not valid paths, leave the output directory
     * or do not exist resolve to empty.
     */
    public Optional<Path> find(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        Path candidate;
        try {
            candidate = outputDir.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            log.warn("Rejected audio file name: {}", e.getMessage());
            return Optional.empty();
        }
        if (!candidate.startsWith(outputDir) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
