package com.ijawAudio.translator.config;

import com.ijawAudio.translator.speech.service.AudioFileStore;
import com.ijawAudio.translator.speech.service.AudioSynthesisService;
import com.ijawAudio.translator.speech.service.RemoteSpeechSynthesizer;
import com.ijawAudio.translator.speech.service.SilentWavSynthesizer;
import com.ijawAudio.translator.speech.service.SpeechTranscriber;
import com.ijawAudio.translator.speech.service.UnavailableSpeechTranscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Speech collaborators of the audio pipeline.
 */
@Slf4j
@Configuration
public class SpeechConfig {

    @Bean
    @ConditionalOnMissingBean
    public SpeechTranscriber speechTranscriber() {
        log.warn("No speech recognition backend configured - audio uploads will not be transcribed");
        return new UnavailableSpeechTranscriber();
    }

    @Bean
    public AudioSynthesisService audioSynthesisService(
            AudioFileStore audioFileStore,
            @Value("${translator.tts.use-remote:false}") boolean useRemote,
            @Value("${translator.tts.url:https://translate.google.com/translate_tts}") String ttsUrl,
            @Value("${translator.tts.lang:en}") String ttsLang) {
        log.info("Audio synthesis - remote TTS: {}, lang: {}, output dir: {}",
                useRemote, ttsLang, audioFileStore.getOutputDir());
        return new AudioSynthesisService(
                useRemote ? new RemoteSpeechSynthesizer(ttsUrl, audioFileStore) : null,
                new SilentWavSynthesizer(audioFileStore),
                ttsLang);
    }
}
