package com.keyco.assist;

import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.config.properties.CacheProperties;
import com.keyco.assist.config.properties.CircuitBreakerProperties;
import com.keyco.assist.config.properties.CredentialsProperties;
import com.keyco.assist.config.properties.DebounceProperties;
import com.keyco.assist.config.properties.RequestProperties;
import com.keyco.assist.config.properties.RetryProperties;
import com.keyco.assist.config.properties.SessionProperties;
import com.keyco.assist.config.properties.SnippetsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        DebounceProperties.class,
        CacheProperties.class,
        CircuitBreakerProperties.class,
        RetryProperties.class,
        BackendProperties.class,
        RequestProperties.class,
        SessionProperties.class,
        SnippetsProperties.class,
        CredentialsProperties.class
})
public class KeycoAssistApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeycoAssistApplication.class, args);
    }

}
