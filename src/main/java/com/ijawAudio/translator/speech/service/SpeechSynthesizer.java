package com.ijawAudio.translator.speech.service;

import java.io.IOException;

/**
 * Text-to-speech collaborator. Implementations write into the {@link AudioFileStore}.
 */
public interface SpeechSynthesizer {

    /**
     * Renders text as audio.
     *
     * @param text Text to voice (may be empty)
     * @param lang Voice language code
     * @return File name of the generated audio inside the store
     * @throws IOException if the audio cannot be produced or written
     */
    String synthesize(String text, String lang) throws IOException;
}
