package com.keyco.assist.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Limits applied to a candidate before anything is sent.
 */
@ConfigurationProperties(prefix = "assist.request")
@Validated
public class RequestProperties {

    /** Longer text is failed fast as a client error. */
    @Positive(message = "Max text length must be positive")
    private int maxTextLength = 4000;

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }
}
