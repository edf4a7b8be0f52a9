/**
 * Command-line entry points for sconv.
 * <p><strong>Role:</strong> Adapter layer parsing {@code key=value} arguments, resolving
 * configuration and mapping outcomes to {@link ca.gc.cra.sconv.api.ExitCode} values.</p>
 * <p><strong>Concurrency:</strong> Each command runs on the calling thread.</p>
 * <p><strong>Security:</strong> Argument names and charset names are validated before use.</p>
 */
package ca.gc.cra.sconv.api;
