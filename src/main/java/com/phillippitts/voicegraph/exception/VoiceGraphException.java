package com.phillippitts.voicegraph.exception;

/**
 * Base exception for all voicegraph application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceGraphException extends RuntimeException {

    public VoiceGraphException(String message) {
        super(message);
    }

    public VoiceGraphException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceGraphException(Throwable cause) {
        super(cause);
    }
}
