package tollgate.core.model.validation;

import java.util.Optional;

/**
 * Comparison of the legacy and enhanced outcomes of one request.
 *
 * <p>A path that timed out is inconclusive and its result is empty. The
 * comparison only reports a discrepancy when both paths concluded and they
 * disagree on validity.
 *
 * @param legacy   the legacy outcome, empty if it timed out or did not run
 * @param enhanced the enhanced outcome, empty if it timed out or did not run
 */
public record ShadowComparison(Optional<ValidationResult> legacy, Optional<ValidationResult> enhanced) {

    public ShadowComparison {
        legacy = legacy == null ? Optional.empty() : legacy;
        enhanced = enhanced == null ? Optional.empty() : enhanced;
    }

    public boolean conclusive() {
        return legacy.isPresent() && enhanced.isPresent();
    }

    public boolean discrepancy() {
        return conclusive() && legacy.get().valid() != enhanced.get().valid();
    }
}
