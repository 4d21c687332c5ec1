package com.ijawAudio.translator.speech.service;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AudioSynthesisServiceTest {

    private final SpeechSynthesizer remote = mock(SpeechSynthesizer.class);
    private final SpeechSynthesizer fallback = mock(SpeechSynthesizer.class);

    @Test
    void usesRemoteWhenItSucceeds() throws IOException {
        when(remote.synthesize("Dó!", "en")).thenReturn("tts_en_12345678.mp3");

        String fileName = new AudioSynthesisService(remote, fallback, "en").synthesize("Dó!", "c1");

        assertEquals("tts_en_12345678.mp3", fileName);
        verifyNoInteractions(fallback);
    }

    @Test
    void fallsBackWhenRemoteFails() throws IOException {
        when(remote.synthesize("Dó!", "en")).thenThrow(new IOException("timeout"));
        when(fallback.synthesize("Dó!", "en")).thenReturn("ijaw_audio_12345678.wav");

        String fileName = new AudioSynthesisService(remote, fallback, "en").synthesize("Dó!", "c1");

        assertEquals("ijaw_audio_12345678.wav", fileName);
    }

    @Test
    void usesFallbackWhenRemoteDisabled() throws IOException {
        when(fallback.synthesize("Dó!", "yo")).thenReturn("ijaw_audio_abcdef12.wav");

        assertEquals("ijaw_audio_abcdef12.wav", new AudioSynthesisService(null, fallback, "yo").synthesize("Dó!", "c1"));
    }

    @Test
    void fallbackFailurePropagates() throws IOException {
        when(fallback.synthesize(anyString(), anyString())).thenThrow(new IOException("disk full"));

        assertThrows(IOException.class, () -> new AudioSynthesisService(null, fallback, "en").synthesize("Dó!", "c1"));
    }
}
