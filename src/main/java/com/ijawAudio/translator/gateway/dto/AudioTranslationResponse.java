package com.ijawAudio.translator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the audio translation pipeline (speech in, Ijaw text and audio out).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AudioTranslationResponse {

    /**
     * Transcript of the uploaded audio, or the transcriber's explanation when none was produced.
     */
    @JsonProperty("english_text")
    private String englishText;

    @JsonProperty("ijaw_text")
    private String ijawText;

    @JsonProperty("audio_filename")
    private String audioFilename;

    /**
     * Relative URL of the generated audio ("/audio/{audio_filename}").
     */
    @JsonProperty("audio_url")
    private String audioUrl;

    @JsonProperty("status")
    private String status;
}
