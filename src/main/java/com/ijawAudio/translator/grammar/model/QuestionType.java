package com.ijawAudio.translator.grammar.model;

import com.ijawAudio.translator.lexicon.util.TextNormalizer;

import java.util.Optional;

/**
 * Question patterns recognised by sentence prefix, checked in declaration order.
 */
public enum QuestionType {
    WHERE("where"),
    HOW_ARE("how are"),
    DO_YOU_HAVE("do you have");

    private final String prefix;

    QuestionType(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Detects the question type of a whole sentence. At most one type matches.
     *
     * @param sentence Sentence as typed
     * @return Matched type, or empty for statements
     */
    public static Optional<QuestionType> detect(String sentence) {
        String text = TextNormalizer.normalize(sentence);
        for (QuestionType type : values()) {
            if (text.startsWith(type.prefix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
