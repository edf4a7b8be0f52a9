package ca.gc.cra.sconv.domain.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal reaction to an allocation failure under the fatal allocation policy.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AbortHandler {
  /** Exit status used when the default handler halts the JVM. */
  int EXIT_STATUS = 70;

  /**
   * Handles an unrecoverable allocation failure. Implementations normally do not return; if they
   * do, the caller continues with an empty buffer.
   *
   * @param message description of the failed request
   */
  void abort(String message);

  /** Logs the failure and halts the JVM without running shutdown hooks. */
  AbortHandler HALT = message -> {
    Logger log = LoggerFactory.getLogger(AbortHandler.class);
    log.error("Out of memory: {}; aborting", message);
    Runtime.getRuntime().halt(EXIT_STATUS);
  };
}
