/**
 * Multi-form string: one logical text value cached as UTF-8, system-charset and wide text.
 * <p>Forms are derived lazily and memoized; a form is marked present only when it was derived
 * exactly. Instances are not thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sconv.application.mstring;
