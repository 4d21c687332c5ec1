package com.ijawAudio.translator.gateway.exception;

/**
 * Exception thrown when the audio pipeline fails on I/O (storing the upload, writing generated audio).
 */
public class AudioProcessingException extends RuntimeException {

    public AudioProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
