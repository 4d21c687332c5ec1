package com.ijawAudio.translator.speech.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Audio synthesis service - voices Ijaw text for the audio pipeline.
 *
 * Uses the remote synthesizer when one is configured; if it is absent or fails, the silent WAV
 * fallback keeps the response well-formed.
 */
@Slf4j
public class AudioSynthesisService {

    private final SpeechSynthesizer remoteSynthesizer;
    private final SpeechSynthesizer fallbackSynthesizer;
    private final String ttsLang;

    /**
     * @param remoteSynthesizer Primary synthesizer, or null when remote TTS is disabled
     * @param fallbackSynthesizer Synthesizer used when the primary is absent or fails
     * @param ttsLang Voice language code passed to the synthesizers
     */
    public AudioSynthesisService(SpeechSynthesizer remoteSynthesizer,
                                 SpeechSynthesizer fallbackSynthesizer,
                                 String ttsLang) {
        this.remoteSynthesizer = remoteSynthesizer;
        this.fallbackSynthesizer = fallbackSynthesizer;
        this.ttsLang = ttsLang;
    }

    /**
     * Generates audio for the text.
     *
     * @param ijawText Text to voice
     * @param correlationId Correlation ID for logging
     * @return File name of the generated audio
     * @throws IOException if even the fallback audio cannot be written
     */
    public String synthesize(String ijawText, String correlationId) throws IOException {
        if (remoteSynthesizer != null) {
            try {
                return remoteSynthesizer.synthesize(ijawText, ttsLang);
            } catch (IOException | RuntimeException e) {
                log.warn("Remote TTS failed, falling back to empty WAV - correlationId: {}, error: {}",
                        correlationId, e.getMessage());
            }
        }
        String fileName = fallbackSynthesizer.synthesize(ijawText, ttsLang);
        log.debug("Fallback audio generated - correlationId: {}, file: {}", correlationId, fileName);
        return fileName;
    }
}
