/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing, configuration bootstrap and
 * profile construction.
 * <p><strong>Pipeline role:</strong> Rejects unusable charset names and settings before a backend handle
 * or buffer is allocated.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Performance:</strong> Branch-only checks; no allocations beyond trimmed strings.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Charset names come from untrusted archive headers; control characters are
 * refused so they never reach logs or platform lookups.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.validation;
