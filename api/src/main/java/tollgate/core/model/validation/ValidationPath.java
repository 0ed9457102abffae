package tollgate.core.model.validation;

/**
 * Which decision path produced a result.
 */
public enum ValidationPath {
    /** Simple store-backed check, current production behavior. */
    LEGACY,
    /** Full validator with caches, rate limiting and risk scoring. */
    ENHANCED;

    public String tag() {
        return name().toLowerCase();
    }
}
