package com.ijawAudio.translator.speech.service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Audio container formats accepted for transcription.
 */
public final class AudioFormats {

    public static final List<String> SUPPORTED_EXTENSIONS = List.of(".wav", ".aiff", ".aif", ".aifc", ".flac");

    private AudioFormats() {}

    /**
     * Lower-cased extension of a file name including the dot, e.g. ".wav".
     *
     * @param fileName File name or path
     * @return Extension, or empty if the name has none
     */
    public static Optional<String> extensionOf(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    public static boolean isSupported(String extension) {
        return extension != null && SUPPORTED_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }
}
