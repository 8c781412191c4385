package com.keyco.assist.exception;

/**
 * Thrown when the shared snippet container cannot be read or parsed.
 */
public class SnippetSourceException extends AssistException {

    private final String location;

    public SnippetSourceException(String location, Throwable cause) {
        super("Snippet container unreadable at: " + location, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
