package com.keyco.assist.domain;

/**
 * Optional token usage reported by the backend.
 */
public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    public static final Usage NONE = new Usage(0, 0, 0);
}
