package com.ijawAudio.translator.lexicon.exception;

/**
 * Exception thrown when the phrase dictionary asset cannot be turned into a lexicon.
 * Raised at start-up only; it aborts application context creation.
 */
public class InvalidLexiconException extends RuntimeException {

    public InvalidLexiconException(String message) {
        super(message);
    }

    public InvalidLexiconException(String message, Throwable cause) {
        super(message, cause);
    }
}
