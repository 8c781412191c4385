package com.keyco.assist.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the process-wide response cache.
 */
@ConfigurationProperties(prefix = "assist.cache")
@Validated
public class CacheProperties {

    /** Enable/disable the response cache. When disabled every fired candidate goes to the network. */
    private boolean enabled = true;

    /** Maximum number of fingerprints retained; oldest-stored entries are evicted first. */
    @Positive(message = "Cache capacity must be positive")
    private int capacity = 64;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }
}
