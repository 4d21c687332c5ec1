package com.ijawAudio.translator.speech.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;

/**
 * Client for a Google-Translate-style TTS endpoint returning MP3 audio.
 * Ijaw has no voice of its own there, so the text is read with the configured language voice.
 */
@Slf4j
public class RemoteSpeechSynthesizer implements SpeechSynthesizer {

    private final RestClient restClient;
    private final AudioFileStore audioFileStore;

    public RemoteSpeechSynthesizer(String ttsUrl, AudioFileStore audioFileStore) {
        this(RestClient.builder()
                .baseUrl(ttsUrl)
                .defaultHeader(HttpHeaders.ACCEPT, "audio/mpeg", MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .build(), audioFileStore);
    }

    RemoteSpeechSynthesizer(RestClient restClient, AudioFileStore audioFileStore) {
        this.restClient = restClient;
        this.audioFileStore = audioFileStore;
    }

    @Override
    public String synthesize(String text, String lang) throws IOException {
        byte[] audio;
        try {
            audio = restClient.get()
                    .uri(uriBuilder -> uriBuilder
                            .queryParam("ie", "UTF-8")
                            .queryParam("client", "tw-ob")
                            .queryParam("tl", lang)
                            .queryParam("q", text == null ? "" : text)
                            .build())
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            throw new IOException("TTS request failed: " + e.getMessage(), e);
        }

        if (audio == null || audio.length == 0) {
            throw new IOException("TTS service returned no audio");
        }

        String fileName = audioFileStore.newFileName("tts_" + lang, ".mp3");
        audioFileStore.write(fileName, audio);
        log.info("Remote TTS synthesized MP3: {} (lang={}, bytes={})", fileName, lang, audio.length);
        return fileName;
    }
}
