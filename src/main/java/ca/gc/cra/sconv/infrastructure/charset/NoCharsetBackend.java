package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import java.util.Optional;

/**
 * Backend that resolves nothing. Profiles then rely on direct Unicode conversion, identity copy
 * and best effort.
 *
 * @since 0.1.0
 */
public final class NoCharsetBackend implements CharsetBackend {

  @Override
  public Optional<BackendHandle> open(String sourceCharset, String targetCharset) {
    return Optional.empty();
  }

  @Override
  public String name() {
    return "none";
  }
}
