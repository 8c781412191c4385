package com.keyco.assist.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the shared snippet container written by the companion app.
 */
@ConfigurationProperties(prefix = "assist.snippets")
@Validated
public class SnippetsProperties {

    /** Spring resource location, e.g. {@code file:/shared/group/snippets.json}. */
    @NotBlank(message = "Snippet location must not be blank")
    private String location = "classpath:snippets/shared-snippets.json";

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }
}
