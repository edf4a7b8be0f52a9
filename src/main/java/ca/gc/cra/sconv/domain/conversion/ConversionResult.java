package ca.gc.cra.sconv.domain.conversion;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Outcome of a conversion that always produced output.
 * <p><strong>Why:</strong> Archive metadata is untrusted; the engine keeps going after a bad byte
 * but must never hide that something was substituted.</p>
 * <p><strong>Role:</strong> Value object returned by codecs, stages, profiles, and the multi-form
 * string cache.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param issues problems encountered while producing the output; empty when the output is exact
 * @since 0.1.0
 */
public record ConversionResult(Set<ConversionIssue> issues) {
  private static final ConversionResult COMPLETE = new ConversionResult(Set.of());

  /**
   * Canonical constructor storing an immutable copy of the issues.
   *
   * @param issues reported problems; must not be {@code null}
   */
  public ConversionResult {
    Objects.requireNonNull(issues, "issues");
    issues = issues.isEmpty()
        ? Set.of()
        : Collections.unmodifiableSet(EnumSet.copyOf(issues));
  }

  /** Returns the shared result for an exact conversion. */
  public static ConversionResult complete() {
    return COMPLETE;
  }

  /**
   * Returns a result carrying a single issue.
   *
   * @param issue problem to report
   * @return failed result
   */
  public static ConversionResult of(ConversionIssue issue) {
    return new ConversionResult(EnumSet.of(Objects.requireNonNull(issue, "issue")));
  }

  /** Returns {@code true} when the output represents the input exactly. */
  public boolean isComplete() {
    return issues.isEmpty();
  }

  /** Returns {@code true} when the given issue was reported. */
  public boolean has(ConversionIssue issue) {
    return issues.contains(issue);
  }

  /**
   * Combines this result with another, keeping every reported issue.
   *
   * @param other result of a later step; may be {@code null}
   * @return merged result
   */
  public ConversionResult merge(ConversionResult other) {
    if (other == null || other.isComplete()) {
      return this;
    }
    if (isComplete()) {
      return other;
    }
    EnumSet<ConversionIssue> merged = EnumSet.copyOf(issues);
    merged.addAll(other.issues);
    return new ConversionResult(merged);
  }

  /**
   * Adds one issue to this result.
   *
   * @param issue problem to record
   * @return result including {@code issue}
   */
  public ConversionResult with(ConversionIssue issue) {
    if (issues.contains(issue)) {
      return this;
    }
    return merge(of(issue));
  }
}
