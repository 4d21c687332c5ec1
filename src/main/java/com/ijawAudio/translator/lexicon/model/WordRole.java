package com.ijawAudio.translator.lexicon.model;

/**
 * Lexical role of a normalized English token.
 * A token resolves to exactly one role; role tables never overlap.
 */
public enum WordRole {
    PRONOUN,
    VERB,
    NOUN,
    ADJECTIVE,
    DETERMINER,
    PREPOSITION,
    UNKNOWN
}
