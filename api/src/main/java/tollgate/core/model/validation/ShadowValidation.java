package tollgate.core.model.validation;

import java.util.concurrent.CompletionStage;

/**
 * The served result of a request together with the pending shadow comparison.
 *
 * <p>The served result is available as soon as the served path decides. The
 * comparison completes once the shadow path decides or times out.
 *
 * @param served     the result returned to the caller
 * @param comparison completes with the legacy/enhanced comparison
 */
public record ShadowValidation(ValidationResult served, CompletionStage<ShadowComparison> comparison) {}
