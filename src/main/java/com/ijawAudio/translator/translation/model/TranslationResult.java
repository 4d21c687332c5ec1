package com.ijawAudio.translator.translation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of translation operation.
 * Contains original text, translated text, and metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TranslationResult {

    public static final String SOURCE_LANGUAGE = "en";
    public static final String TARGET_LANGUAGE = "ijw";

    /**
     * Original English text as received.
     */
    private String originalText;

    /**
     * Ijaw translation.
     */
    private String translatedText;

    @Builder.Default
    private String sourceLanguage = SOURCE_LANGUAGE;

    @Builder.Default
    private String targetLanguage = TARGET_LANGUAGE;

    /**
     * Which stage of the translation pipeline produced the text.
     */
    private TranslationStrategy strategy;
}
