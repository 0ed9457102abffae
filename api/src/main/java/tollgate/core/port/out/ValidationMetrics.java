package tollgate.core.port.out;

import java.time.Duration;

import tollgate.core.model.validation.ValidationPath;

/**
 * Port interface for recording validation metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface ValidationMetrics {

    /**
     * Record the outcome of one validation path.
     *
     * @param path    the path that decided
     * @param outcome short outcome label
     * @param latency how long the path took
     */
    void recordDecision(ValidationPath path, String outcome, Duration latency);

    /**
     * Record a disagreement between the legacy and enhanced paths.
     *
     * @param legacyValid   the legacy decision
     * @param enhancedValid the enhanced decision
     */
    void recordDiscrepancy(boolean legacyValid, boolean enhancedValid);

    /**
     * Record a path that did not decide in time.
     *
     * @param path the path that timed out
     */
    void recordTimeout(ValidationPath path);

    /**
     * Record a cache probe.
     *
     * @param cache the cache name
     * @param hit   whether the probe hit
     */
    void recordCacheAccess(String cache, boolean hit);

    void recordExtension();

    void recordAuditDropped();

    void recordAuditSinkFailure();
}
