package com.ijawAudio.translator.gateway.controller;

import com.ijawAudio.translator.gateway.dto.AudioTranslationResponse;
import com.ijawAudio.translator.gateway.dto.TextTranslationResponse;
import com.ijawAudio.translator.gateway.exception.AudioFileNotFoundException;
import com.ijawAudio.translator.gateway.exception.AudioProcessingException;
import com.ijawAudio.translator.gateway.exception.UnsupportedAudioException;
import com.ijawAudio.translator.gateway.service.TranslationGatewayService;
import com.ijawAudio.translator.grammar.model.GrammarInfo;
import com.ijawAudio.translator.grammar.service.GrammarEngine;
import com.ijawAudio.translator.translation.model.TranslationStrategy;
import com.ijawAudio.translator.translation.service.DictionaryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = TranslatorController.class)
class TranslatorControllerTest {

    @Autowired MockMvc mvc;
    @MockBean TranslationGatewayService gatewayService;
    @MockBean DictionaryService dictionaryService;
    @MockBean GrammarEngine grammarEngine;

    @TempDir
    Path tempDir;

    @Test
    void rootReportsRunning() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("English to Ijaw Audio Translator API"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    void translateAudioReturnsSnakeCaseResponse() throws Exception {
        when(gatewayService.translateAudio(any())).thenReturn(AudioTranslationResponse.builder()
                .englishText("i am happy")
                .ijawText("Arí hapi ye")
                .audioFilename("ijaw_audio_1a2b3c4d.wav")
                .audioUrl("/audio/ijaw_audio_1a2b3c4d.wav")
                .status("success")
                .build());

        mvc.perform(multipart("/translate")
                        .file(new MockMultipartFile("audio_file", "speech.wav", "audio/wav", new byte[]{1, 2})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.english_text").value("i am happy"))
                .andExpect(jsonPath("$.ijaw_text").value("Arí hapi ye"))
                .andExpect(jsonPath("$.audio_filename").value("ijaw_audio_1a2b3c4d.wav"))
                .andExpect(jsonPath("$.audio_url").value("/audio/ijaw_audio_1a2b3c4d.wav"))
                .andExpect(jsonPath("$.status").value("success"));
    }

    @Test
    void unsupportedAudioIsBadRequest() throws Exception {
        when(gatewayService.translateAudio(any())).thenThrow(new UnsupportedAudioException("File must be an audio file"));

        mvc.perform(multipart("/translate")
                        .file(new MockMultipartFile("audio_file", "notes.txt", "text/plain", new byte[]{1})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_AUDIO"))
                .andExpect(jsonPath("$.message").value("File must be an audio file"));
    }

    @Test
    void missingUploadIsBadRequest() throws Exception {
        mvc.perform(multipart("/translate"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void processingFailureIsServerError() throws Exception {
        when(gatewayService.translateAudio(any()))
                .thenThrow(new AudioProcessingException("disk full", new IOException("disk full")));

        mvc.perform(multipart("/translate")
                        .file(new MockMultipartFile("audio_file", "speech.wav", "audio/wav", new byte[]{1})))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Translation failed: disk full"));
    }

    @Test
    void translateTextReturnsStrategy() throws Exception {
        when(gatewayService.translateText(any())).thenReturn(TextTranslationResponse.builder()
                .englishText("you have water")
                .ijawText("Ị bení sabi")
                .strategy(TranslationStrategy.GRAMMAR)
                .build());

        mvc.perform(post("/translate/text").contentType("application/json")
                        .content("{\"text\":\"you have water\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ijaw_text").value("Ị bení sabi"))
                .andExpect(jsonPath("$.strategy").value("GRAMMAR"));
    }

    @Test
    void blankTextFailsValidation() throws Exception {
        mvc.perform(post("/translate/text").contentType("application/json")
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        verifyNoInteractions(gatewayService);
    }

    @Test
    void audioIsServedWithMediaTypeByExtension() throws Exception {
        Path mp3 = Files.write(tempDir.resolve("tts_en_1a2b3c4d.mp3"), new byte[]{9, 8, 7});
        Path wav = Files.write(tempDir.resolve("ijaw_audio_1a2b3c4d.wav"), new byte[]{1});
        when(gatewayService.resolveAudio("tts_en_1a2b3c4d.mp3")).thenReturn(mp3);
        when(gatewayService.resolveAudio("ijaw_audio_1a2b3c4d.wav")).thenReturn(wav);

        mvc.perform(get("/audio/tts_en_1a2b3c4d.mp3"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/mpeg"))
                .andExpect(header().string("Content-Disposition", containsString("tts_en_1a2b3c4d.mp3")))
                .andExpect(content().bytes(new byte[]{9, 8, 7}));
        mvc.perform(get("/audio/ijaw_audio_1a2b3c4d.wav"))
                .andExpect(status().isOk())
                .andExpect(content().contentType("audio/wav"));
    }

    @Test
    void missingAudioIsNotFound() throws Exception {
        when(gatewayService.resolveAudio("nope.wav")).thenThrow(new AudioFileNotFoundException("Audio file not found"));

        mvc.perform(get("/audio/nope.wav"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Audio file not found"));
    }

    @Test
    void dictionaryListsBothMappings() throws Exception {
        when(dictionaryService.entries()).thenReturn(Map.of("hello", "Dó!", "water", "bení"));
        when(dictionaryService.audioEntries()).thenReturn(Map.of());

        mvc.perform(get("/dictionary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.translation_dict.hello").value("Dó!"))
                .andExpect(jsonPath("$.translation_count").value(2))
                .andExpect(jsonPath("$.audio_count").value(0));
    }

    @Test
    void addTranslationEchoesEntry() throws Exception {
        mvc.perform(post("/dictionary/add").param("english_word", "Peace").param("ijaw_word", "fred"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Added translation: Peace -> fred"));
        verify(dictionaryService).addTranslation("Peace", "fred");
    }

    @Test
    void addTranslationRequiresBothParameters() throws Exception {
        mvc.perform(post("/dictionary/add").param("english_word", "peace"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(dictionaryService);
    }

    @Test
    void addTranslationRejectsBlankValues() throws Exception {
        doThrow(new IllegalArgumentException("english_word and ijaw_word must not be blank"))
                .when(dictionaryService).addTranslation(" ", "fred");

        mvc.perform(post("/dictionary/add").param("english_word", " ").param("ijaw_word", "fred"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void healthReportsDictionaryState() throws Exception {
        when(dictionaryService.size()).thenReturn(44);

        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.dictionaries_loaded").value(true))
                .andExpect(jsonPath("$.translation_count").value(44));
    }

    @Test
    void grammarReportsCounts() throws Exception {
        when(grammarEngine.grammarInfo()).thenReturn(GrammarInfo.builder()
                .pronounsCount(12).verbsCount(41).nounsCount(29).adjectivesCount(30)
                .patternsCount(7).totalDictionaryEntries(44)
                .build());

        mvc.perform(get("/grammar"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.patterns_count").value(7))
                .andExpect(jsonPath("$.verbs_count").value(41));
    }
}
