package com.ijawAudio.translator.grammar.model;

import lombok.Builder;

/**
 * Sentence roles found by one tagger pass.
 *
 * Each slot holds the untranslated English token (lower-cased, edge punctuation removed) or null.
 * Created per request and never modified after tagging.
 *
 * @param subject first non-possessive pronoun
 * @param object first noun
 * @param verb first verb
 * @param adjective first adjective
 * @param location place noun seen after the object slot was filled
 * @param time temporal word
 * @param questionType question pattern matched on the sentence prefix
 */
@Builder
public record ParsedSlots(
        String subject,
        String object,
        String verb,
        String adjective,
        String location,
        String time,
        QuestionType questionType) {

    public static final ParsedSlots EMPTY = ParsedSlots.builder().build();

    public boolean hasSubject() {
        return subject != null;
    }

    public boolean hasObject() {
        return object != null;
    }

    public boolean hasVerb() {
        return verb != null;
    }

    public boolean hasAdjective() {
        return adjective != null;
    }

    public boolean hasLocation() {
        return location != null;
    }

    public boolean hasTime() {
        return time != null;
    }

    public boolean isQuestion() {
        return questionType != null;
    }
}
