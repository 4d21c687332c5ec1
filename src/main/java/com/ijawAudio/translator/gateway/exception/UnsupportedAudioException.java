package com.ijawAudio.translator.gateway.exception;

/**
 * Exception thrown when an upload is not audio or uses an unsupported container format.
 */
public class UnsupportedAudioException extends RuntimeException {

    public UnsupportedAudioException(String message) {
        super(message);
    }
}
