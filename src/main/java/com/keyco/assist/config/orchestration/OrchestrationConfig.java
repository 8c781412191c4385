package com.keyco.assist.config.orchestration;

import com.keyco.assist.config.ThreadPoolConfig;
import com.keyco.assist.config.properties.BackendProperties;
import com.keyco.assist.config.properties.CacheProperties;
import com.keyco.assist.config.properties.CircuitBreakerProperties;
import com.keyco.assist.config.properties.DebounceProperties;
import com.keyco.assist.config.properties.RequestProperties;
import com.keyco.assist.config.properties.RetryProperties;
import com.keyco.assist.config.properties.SessionProperties;
import com.keyco.assist.service.cache.ResponseCache;
import com.keyco.assist.service.debounce.DelayScheduler;
import com.keyco.assist.service.debounce.ExecutorDelayScheduler;
import com.keyco.assist.service.metrics.AssistMetrics;
import com.keyco.assist.service.metrics.AssistMetricsPublisher;
import com.keyco.assist.service.orchestration.AssistSessionRegistry;
import com.keyco.assist.service.orchestration.SessionDependencies;
import com.keyco.assist.service.resilience.CircuitBreakerRegistry;
import com.keyco.assist.service.resilience.RetryScheduler;
import com.keyco.assist.service.sequence.FingerprintCalculator;
import com.keyco.assist.service.sink.EventPublishingResultSink;
import com.keyco.assist.service.sink.ResultSink;
import com.keyco.assist.service.sink.SessionOutcomeStore;
import com.keyco.assist.service.transport.BackendTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the process-wide orchestration singletons (breaker registry, response cache, retry
 * policy, timers) and the session registry built from them.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(Clock clock, ApplicationEventPublisher publisher) {
        this.clock = clock;
        this.publisher = publisher;
    }

    @Bean
    public FingerprintCalculator fingerprintCalculator() {
        return new FingerprintCalculator();
    }

    @Bean
    public ResponseCache responseCache(CacheProperties cacheProperties) {
        return new ResponseCache(cacheProperties.getCapacity(), clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties circuitBreakerProperties,
                                                         BackendProperties backendProperties,
                                                         RetryProperties retryProperties) {
        Duration probeLease = CircuitBreakerRegistry.probeLeaseFor(backendProperties, retryProperties);
        LOG.info("Circuit probe lease {} (probe-timeout {})", probeLease, circuitBreakerProperties.probeTimeout());
        return new CircuitBreakerRegistry(circuitBreakerProperties, probeLease, clock, publisher);
    }

    @Bean
    public RetryScheduler retryScheduler(RetryProperties retryProperties) {
        return new RetryScheduler(retryProperties);
    }

    @Bean
    public DelayScheduler delayScheduler(@Qualifier("assistScheduler") TaskScheduler assistScheduler) {
        return new ExecutorDelayScheduler(assistScheduler, clock, ThreadPoolConfig.mdcPropagatingDecorator());
    }

    @Bean
    public ResultSink resultSink() {
        return new EventPublishingResultSink(publisher);
    }

    @Bean
    public AssistMetricsPublisher assistMetricsPublisher(AssistMetrics metrics) {
        return new AssistMetricsPublisher(metrics);
    }

    @Bean
    public SessionDependencies sessionDependencies(BackendTransport backendTransport,
                                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                                   ResponseCache responseCache,
                                                   CacheProperties cacheProperties,
                                                   RetryScheduler retryScheduler,
                                                   DelayScheduler delayScheduler,
                                                   ResultSink resultSink,
                                                   AssistMetricsPublisher assistMetricsPublisher,
                                                   FingerprintCalculator fingerprintCalculator,
                                                   DebounceProperties debounceProperties,
                                                   RequestProperties requestProperties) {
        if (!cacheProperties.isEnabled()) {
            LOG.info("Response cache disabled; every fired candidate goes to the backend");
        }
        return new SessionDependencies(
                backendTransport,
                circuitBreakerRegistry,
                cacheProperties.isEnabled() ? responseCache : null,
                retryScheduler,
                delayScheduler,
                resultSink,
                assistMetricsPublisher,
                fingerprintCalculator,
                debounceProperties,
                requestProperties,
                clock);
    }

    @Bean
    public AssistSessionRegistry assistSessionRegistry(SessionDependencies sessionDependencies,
                                                       SessionOutcomeStore sessionOutcomeStore,
                                                       SessionProperties sessionProperties) {
        return new AssistSessionRegistry(sessionDependencies, sessionOutcomeStore, sessionProperties.idleTimeout());
    }
}
