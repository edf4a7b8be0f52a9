package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.logging.Logs;
import java.nio.charset.Charset;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Charset backend that resolves names the way Windows archivers do: to a
 * codepage number first, then to the JVM charset for that codepage.
 * <p><strong>Why:</strong> Archives written on Windows name charsets loosely ({@code LATIN1},
 * {@code CP367}, {@code ASCII} all mean codepage 1252 there); two names with the same codepage must
 * be treated as the same charset.</p>
 * <p><strong>Thread-safety:</strong> Stateless; handles are single-threaded.</p>
 *
 * @since 0.1.0
 * @see Codepages
 */
public final class CodepageCharsetBackend implements CharsetBackend {
  private static final Logger log = LoggerFactory.getLogger(CodepageCharsetBackend.class);

  @Override
  public Optional<BackendHandle> open(String sourceCharset, String targetCharset) {
    Optional<Charset> source = charsetFor(sourceCharset);
    Optional<Charset> target = charsetFor(targetCharset);
    if (source.isEmpty() || target.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new JdkBackendHandle(source.get(), target.get()));
  }

  /** Names are the same charset when equal ignoring case or when they share a codepage. */
  @Override
  public boolean sameCharset(String first, String second) {
    if (CharsetBackend.super.sameCharset(first, second)) {
      return true;
    }
    OptionalInt a = Codepages.codepageOf(first);
    OptionalInt b = Codepages.codepageOf(second);
    return a.isPresent() && b.isPresent() && a.getAsInt() == b.getAsInt();
  }

  @Override
  public String name() {
    return "codepage";
  }

  private static Optional<Charset> charsetFor(String name) {
    OptionalInt codepage = Codepages.codepageOf(name);
    if (codepage.isEmpty()) {
      log.debug("No codepage for charset {}", Logs.truncate(name));
      return Optional.empty();
    }
    Optional<Charset> charset = Codepages.charsetOf(codepage.getAsInt());
    if (charset.isEmpty()) {
      log.debug("Codepage {} ({}) has no JVM charset", codepage.getAsInt(), Logs.truncate(name));
    }
    return charset;
  }
}
