package com.ijawAudio.translator.gateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ijawAudio.translator.translation.model.TranslationStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for text translation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TextTranslationResponse {

    @JsonProperty("english_text")
    private String englishText;

    @JsonProperty("ijaw_text")
    private String ijawText;

    @JsonProperty("strategy")
    private TranslationStrategy strategy;
}
