package com.ijawAudio.translator.gateway.exception;

/**
 * Exception thrown when a requested generated audio file does not exist.
 */
public class AudioFileNotFoundException extends RuntimeException {

    public AudioFileNotFoundException(String message) {
        super(message);
    }
}
