package com.ijawAudio.translator.translation.model;

/**
 * How a translation was produced.
 */
public enum TranslationStrategy {
    /**
     * Exact full-phrase hit in the phrase dictionary.
     */
    PHRASE_DICTIONARY,
    /**
     * Rendered by the grammar engine.
     */
    GRAMMAR,
    /**
     * Per-word dictionary lookup after the engine gave nothing better than the input.
     */
    WORD_BY_WORD,
    /**
     * Empty input.
     */
    NONE
}
