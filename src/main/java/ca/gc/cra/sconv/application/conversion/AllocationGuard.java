package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.AbortHandler;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured {@link AllocationPolicy} to buffer exhaustion.
 *
 * @since 0.1.0
 */
final class AllocationGuard {
  private static final Logger log = LoggerFactory.getLogger(AllocationGuard.class);

  private final AllocationPolicy policy;
  private final AbortHandler abortHandler;

  AllocationGuard(AllocationPolicy policy, AbortHandler abortHandler) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.abortHandler = Objects.requireNonNull(abortHandler, "abortHandler");
  }

  /**
   * Handles exhaustion raised by a conversion. Under the fatal policy the abort handler runs first;
   * if it returns, the exception is rethrown like the recoverable policy does.
   */
  BufferExhaustedException onExhausted(BufferExhaustedException ex) {
    if (policy == AllocationPolicy.FATAL) {
      abortHandler.abort(ex.getMessage());
    } else {
      log.debug("Conversion buffer exhausted: {}", ex.getMessage());
    }
    return ex;
  }
}
