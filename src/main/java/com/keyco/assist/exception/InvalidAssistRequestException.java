package com.keyco.assist.exception;

/**
 * Thrown at the REST boundary when the input surface sends an unusable command
 * (unknown mode, missing body field).
 */
public class InvalidAssistRequestException extends AssistException {

    private final String reason;

    public InvalidAssistRequestException(String reason) {
        super("Invalid assist request: " + reason);
        this.reason = reason;
    }

    public InvalidAssistRequestException(String reason, Throwable cause) {
        super("Invalid assist request: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
