package com.ijawAudio.translator.speech.service;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Transcriber used when no speech recognition backend is deployed.
 * Validates the upload like a real backend would, then reports that recognition is unavailable.
 */
@Slf4j
public class UnavailableSpeechTranscriber implements SpeechTranscriber {

    static final String NOT_FOUND_MESSAGE = "Audio file not found. Please try again.";
    static final String UNAVAILABLE_MESSAGE = "Speech recognition is not available on this deployment. "
            + "Please use text translation or upload WAV/AIFF when the service is enabled.";

    @Override
    public String transcribe(Path audioFile) {
        log.info("Processing audio file: {}", audioFile);

        if (audioFile == null || !Files.exists(audioFile)) {
            log.error("Audio file not found: {}", audioFile);
            return NOT_FOUND_MESSAGE;
        }

        String extension = AudioFormats.extensionOf(audioFile.getFileName().toString()).orElse("");
        if (!AudioFormats.isSupported(extension)) {
            log.warn("Unsupported audio format: {}", extension);
            return "Unsupported audio format (" + extension + "). Please upload a WAV, AIFF, or FLAC file.";
        }

        log.warn("Speech recognition backend is not configured, returning placeholder message");
        return UNAVAILABLE_MESSAGE;
    }
}
