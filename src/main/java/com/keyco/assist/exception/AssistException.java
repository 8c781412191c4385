package com.keyco.assist.exception;

/**
 * Base exception for all keyco-assist application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class AssistException extends RuntimeException {

    public AssistException(String message) {
        super(message);
    }

    public AssistException(String message, Throwable cause) {
        super(message, cause);
    }

    public AssistException(Throwable cause) {
        super(cause);
    }
}
