package com.ijawAudio.translator.gateway.controller;

import com.ijawAudio.translator.gateway.dto.AudioTranslationResponse;
import com.ijawAudio.translator.gateway.dto.DictionaryResponse;
import com.ijawAudio.translator.gateway.dto.HealthResponse;
import com.ijawAudio.translator.gateway.dto.TextTranslationRequest;
import com.ijawAudio.translator.gateway.dto.TextTranslationResponse;
import com.ijawAudio.translator.gateway.service.TranslationGatewayService;
import com.ijawAudio.translator.grammar.model.GrammarInfo;
import com.ijawAudio.translator.grammar.service.GrammarEngine;
import com.ijawAudio.translator.translation.service.DictionaryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Translator REST controller - thin HTTP layer over the translation pipeline.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Map multipart uploads, JSON bodies and query parameters
 * - Delegate business logic to TranslationGatewayService, DictionaryService and GrammarEngine
 */
@RestController
@CrossOrigin(origins = "${translator.cors.allowed-origins:http://localhost:3000}")
@RequiredArgsConstructor
public class TranslatorController {

    private static final MediaType AUDIO_MPEG = MediaType.parseMediaType("audio/mpeg");
    private static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final TranslationGatewayService translationGatewayService;
    private final DictionaryService dictionaryService;
    private final GrammarEngine grammarEngine;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("message", "English to Ijaw Audio Translator API");
        response.put("status", "running");
        return ResponseEntity.ok(response);
    }

    /**
     * Audio translation endpoint: transcribe, translate, synthesize.
     *
     * @param audioFile WAV, AIFF or FLAC upload
     * @return Transcript, Ijaw text and the generated audio location
     */
    @PostMapping(value = "/translate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<AudioTranslationResponse> translateAudio(@RequestParam("audio_file") MultipartFile audioFile) {
        return ResponseEntity.ok(translationGatewayService.translateAudio(audioFile));
    }

    @PostMapping("/translate/text")
    public ResponseEntity<TextTranslationResponse> translateText(@Valid @RequestBody TextTranslationRequest request) {
        return ResponseEntity.ok(translationGatewayService.translateText(request));
    }

    /**
     * Serves a generated audio file, MP3 or WAV.
     */
    @GetMapping("/audio/{filename}")
    public ResponseEntity<Resource> getAudio(@PathVariable String filename) {
        Path file = translationGatewayService.resolveAudio(filename);
        MediaType mediaType = filename.toLowerCase(Locale.ROOT).endsWith(".mp3") ? AUDIO_MPEG : AUDIO_WAV;
        return ResponseEntity.ok()
                .contentType(mediaType)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(new FileSystemResource(file));
    }

    @GetMapping("/dictionary")
    public ResponseEntity<DictionaryResponse> getDictionary() {
        Map<String, String> translations = dictionaryService.entries();
        Map<String, String> audio = dictionaryService.audioEntries();
        return ResponseEntity.ok(DictionaryResponse.builder()
                .translationDict(translations)
                .audioDict(audio)
                .translationCount(translations.size())
                .audioCount(audio.size())
                .build());
    }

    /**
     * Adds a dictionary entry and persists the dictionary.
     *
     * @param englishWord English word or phrase
     * @param ijawWord Ijaw translation
     */
    @PostMapping("/dictionary/add")
    public ResponseEntity<Map<String, String>> addTranslation(@RequestParam("english_word") String englishWord,
                                                              @RequestParam("ijaw_word") String ijawWord) {
        dictionaryService.addTranslation(englishWord, ijawWord);
        return ResponseEntity.ok(Map.of("message", "Added translation: " + englishWord + " -> " + ijawWord));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        int count = dictionaryService.size();
        return ResponseEntity.ok(HealthResponse.builder()
                .status("healthy")
                .dictionariesLoaded(count > 0)
                .translationCount(count)
                .build());
    }

    @GetMapping("/grammar")
    public ResponseEntity<GrammarInfo> grammar() {
        return ResponseEntity.ok(grammarEngine.grammarInfo());
    }
}
