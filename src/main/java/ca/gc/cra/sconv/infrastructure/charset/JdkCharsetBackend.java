package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.logging.Logs;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Charset backend over the charsets installed in the JVM.
 * <p><strong>Why:</strong> {@code java.nio.charset} knows every legacy encoding archives commonly use;
 * it is the default way sconv reaches them.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve names through {@link Charset#forName(String)}, falling back to a small alias
 *       table for names other tools spell differently.</li>
 *   <li>Open one {@link JdkBackendHandle} per profile.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; handles are single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class JdkCharsetBackend implements CharsetBackend {
  private static final Logger log = LoggerFactory.getLogger(JdkCharsetBackend.class);

  /** Used only when the JVM does not know the name itself. */
  private static final Map<String, String> FALLBACK_NAMES = Map.of(
      "CP932", "Shift_JIS",
      "SJIS", "Shift_JIS",
      "EUCJP", "EUC-JP",
      "EUCKR", "EUC-KR",
      "EUCCN", "GB2312");

  @Override
  public Optional<BackendHandle> open(String sourceCharset, String targetCharset) {
    Optional<Charset> source = resolve(sourceCharset);
    Optional<Charset> target = resolve(targetCharset);
    if (source.isEmpty() || target.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new JdkBackendHandle(source.get(), target.get()));
  }

  /** Names are the same charset when equal ignoring case or when both resolve to one charset. */
  @Override
  public boolean sameCharset(String first, String second) {
    if (CharsetBackend.super.sameCharset(first, second)) {
      return true;
    }
    Optional<Charset> a = resolve(first);
    return a.isPresent() && a.equals(resolve(second));
  }

  @Override
  public String name() {
    return "jdk";
  }

  /**
   * Resolves a charset name, trying the alias table when the JVM does not know it.
   *
   * @return the charset, or empty when neither lookup succeeds
   */
  public static Optional<Charset> resolve(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    Optional<Charset> direct = lookup(name.trim());
    if (direct.isPresent()) {
      return direct;
    }
    String fallback = FALLBACK_NAMES.get(name.trim().toUpperCase(Locale.ROOT));
    if (fallback != null) {
      log.debug("Charset {} unknown to the JVM; trying {}", Logs.truncate(name), fallback);
      return lookup(fallback);
    }
    return Optional.empty();
  }

  private static Optional<Charset> lookup(String name) {
    try {
      return Optional.of(Charset.forName(name));
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      log.debug("Charset {} not available: {}", Logs.truncate(name), ex.getClass().getSimpleName());
      return Optional.empty();
    }
  }
}
