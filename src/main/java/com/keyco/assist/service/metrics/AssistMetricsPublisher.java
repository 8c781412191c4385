package com.keyco.assist.service.metrics;

import com.keyco.assist.domain.FailureKind;
import com.keyco.assist.domain.Mode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link AssistMetrics} used by the request coordinator.
 *
 * <p><b>Null Safety:</b> all methods tolerate a missing {@link AssistMetrics}, so coordinators
 * can run without a meter registry in tests.
 */
public final class AssistMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(AssistMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and defaults.
     */
    public static final AssistMetricsPublisher NOOP = new AssistMetricsPublisher(null);

    private final AssistMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public AssistMetricsPublisher(AssistMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("AssistMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records a published result.
     *
     * @param mode candidate mode
     * @param durationNanos resolution time, ignored for cache hits
     * @param fromCache whether the result was served from the cache
     */
    public void recordSuccess(Mode mode, long durationNanos, boolean fromCache) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSuccess(mode.wireName(), fromCache);
        if (!fromCache) {
            metrics.recordLatency(mode.wireName(), durationNanos);
        }
    }

    public void recordFailure(Mode mode, FailureKind kind) {
        if (metrics == null) {
            return;
        }
        metrics.incrementFailure(mode.wireName(), kind.tag());
    }

    public void recordCancelled(Mode mode) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCancelled(mode.wireName());
    }

    public void recordRetry(Mode mode, FailureKind reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementRetry(mode.wireName(), reason.tag());
    }

    /**
     * @return true if metrics are available, false if running in test mode
     */
    public boolean isEnabled() {
        return metrics != null;
    }
}
