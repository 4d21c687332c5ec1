package com.ijawAudio.translator.gateway.service;

import com.ijawAudio.translator.gateway.dto.AudioTranslationResponse;
import com.ijawAudio.translator.gateway.dto.TextTranslationRequest;
import com.ijawAudio.translator.gateway.dto.TextTranslationResponse;
import com.ijawAudio.translator.gateway.exception.AudioFileNotFoundException;
import com.ijawAudio.translator.gateway.exception.AudioProcessingException;
import com.ijawAudio.translator.gateway.exception.UnsupportedAudioException;
import com.ijawAudio.translator.speech.service.AudioFileStore;
import com.ijawAudio.translator.speech.service.AudioFormats;
import com.ijawAudio.translator.speech.service.AudioSynthesisService;
import com.ijawAudio.translator.speech.service.SpeechTranscriber;
import com.ijawAudio.translator.translation.model.TranslationResult;
import com.ijawAudio.translator.translation.service.IjawTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Gateway service - business logic behind the translator HTTP API.
 *
 * Responsibilities:
 * - Generate a correlationId per request
 * - Validate uploaded audio (content type, container format)
 * - Run the audio pipeline: store upload, transcribe, translate, synthesize
 * - Always remove the temporary upload
 * - Resolve generated audio files for download
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TranslationGatewayService {

    static final String DEFAULT_UPLOAD_NAME = "audio.wav";

    private final SpeechTranscriber speechTranscriber;
    private final IjawTranslator ijawTranslator;
    private final AudioSynthesisService audioSynthesisService;
    private final AudioFileStore audioFileStore;

    /**
     * Translates spoken English audio into Ijaw text and audio.
     *
     * @param audioFile Uploaded audio
     * @return Transcript, translation and the generated audio file
     * @throws UnsupportedAudioException if the upload is not audio or not WAV/AIFF/FLAC
     * @throws AudioProcessingException if the upload or the generated audio cannot be written
     */
    public AudioTranslationResponse translateAudio(MultipartFile audioFile) {
        String correlationId = UUID.randomUUID().toString();
        String extension = validateUpload(audioFile, correlationId);

        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("ijaw_upload_", extension);
            Files.write(tempFile, audioFile.getBytes());

            String englishText = speechTranscriber.transcribe(tempFile);
            if (englishText.startsWith("Error") || englishText.startsWith("Sorry")) {
                log.warn("Transcription issue - correlationId: {}, message: {}", correlationId, englishText);
            }
            log.info("Audio transcribed - correlationId: {}, length: {}", correlationId, englishText.length());

            TranslationResult translation = ijawTranslator.translate(englishText, correlationId);
            String audioFilename = audioSynthesisService.synthesize(translation.getTranslatedText(), correlationId);
            log.info("Audio translation completed - correlationId: {}, audio: {}", correlationId, audioFilename);

            return AudioTranslationResponse.builder()
                    .englishText(englishText)
                    .ijawText(translation.getTranslatedText())
                    .audioFilename(audioFilename)
                    .audioUrl("/audio/" + audioFilename)
                    .status("success")
                    .build();
        } catch (IOException e) {
            log.error("Audio translation failed - correlationId: {}", correlationId, e);
            throw new AudioProcessingException(e.getMessage(), e);
        } finally {
            deleteQuietly(tempFile, correlationId);
        }
    }

    /**
     * Translates typed English text.
     */
    public TextTranslationResponse translateText(TextTranslationRequest request) {
        String correlationId = UUID.randomUUID().toString();
        log.info("Text translation request - correlationId: {}, length: {}", correlationId, request.getText().length());

        TranslationResult translation = ijawTranslator.translate(request.getText(), correlationId);
        return TextTranslationResponse.builder()
                .englishText(request.getText())
                .ijawText(translation.getTranslatedText())
                .strategy(translation.getStrategy())
                .build();
    }

    /**
     * Resolves a generated audio file by name.
     *
     * @throws AudioFileNotFoundException if no such file exists in the output directory
     */
    public Path resolveAudio(String filename) {
        return audioFileStore.find(filename)
                .orElseThrow(() -> new AudioFileNotFoundException("Audio file not found"));
    }

    private String validateUpload(MultipartFile audioFile, String correlationId) {
        String contentType = audioFile.getContentType();
        if (contentType == null || !contentType.startsWith("audio/")) {
            log.warn("Rejected non-audio upload - correlationId: {}, contentType: {}", correlationId, contentType);
            throw new UnsupportedAudioException("File must be an audio file");
        }

        String originalName = audioFile.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            originalName = DEFAULT_UPLOAD_NAME;
        }
        String extension = AudioFormats.extensionOf(originalName).orElse("");
        if (!AudioFormats.isSupported(extension)) {
            log.warn("Rejected audio format - correlationId: {}, extension: {}", correlationId, extension);
            throw new UnsupportedAudioException(
                    "Unsupported audio format: " + extension + ". Supported formats: WAV, AIFF, FLAC");
        }
        return extension;
    }

    private void deleteQuietly(Path tempFile, String correlationId) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not clean up temp file - correlationId: {}, file: {}, error: {}",
                    correlationId, tempFile, e.getMessage());
        }
    }
}
