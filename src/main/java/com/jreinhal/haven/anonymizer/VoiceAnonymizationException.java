package com.jreinhal.haven.anonymizer;

/**
 * The voice anonymizer could not produce anonymized audio when it was required.
 */
public class VoiceAnonymizationException extends RuntimeException {
    public VoiceAnonymizationException(String message) {
        super(message);
    }

    public VoiceAnonymizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
