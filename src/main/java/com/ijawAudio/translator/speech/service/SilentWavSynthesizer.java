package com.ijawAudio.translator.speech.service;

import lombok.RequiredArgsConstructor;

import java.io.IOException;

/**
 * Fallback synthesizer that writes a valid but empty WAV file (44.1 kHz, 16-bit, mono, no samples).
 * Keeps the audio pipeline answering when no TTS backend is reachable.
 */
@RequiredArgsConstructor
public class SilentWavSynthesizer implements SpeechSynthesizer {

    private static final byte[] EMPTY_WAV = {
            0x52, 0x49, 0x46, 0x46,                         // "RIFF"
            0x24, 0x00, 0x00, 0x00,                         // chunk size 36
            0x57, 0x41, 0x56, 0x45,                         // "WAVE"
            0x66, 0x6D, 0x74, 0x20,                         // "fmt "
            0x10, 0x00, 0x00, 0x00,                         // fmt chunk size 16
            0x01, 0x00,                                     // PCM
            0x01, 0x00,                                     // mono
            0x44, (byte) 0xAC, 0x00, 0x00,                  // 44100 Hz
            (byte) 0x88, 0x58, 0x01, 0x00,                  // byte rate 88200
            0x02, 0x00,                                     // block align
            0x10, 0x00,                                     // 16 bits per sample
            0x64, 0x61, 0x74, 0x61,                         // "data"
            0x00, 0x00, 0x00, 0x00                          // no samples
    };

    private final AudioFileStore audioFileStore;

    @Override
    public String synthesize(String text, String lang) throws IOException {
        String fileName = audioFileStore.newFileName("ijaw_audio", ".wav");
        audioFileStore.write(fileName, EMPTY_WAV.clone());
        return fileName;
    }
}
