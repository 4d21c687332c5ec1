package com.ijawAudio.translator.speech.service;

import java.nio.file.Path;

/**
 * Speech-to-text collaborator.
 *
 * Contract:
 * - never throws; problems are reported as a user-facing message in place of the transcript
 * - real transcripts are returned trimmed and lower-cased
 */
public interface SpeechTranscriber {

    /**
     * @param audioFile WAV, AIFF or FLAC file
     * @return Transcript, or a message describing why none could be produced
     */
    String transcribe(Path audioFile);
}
