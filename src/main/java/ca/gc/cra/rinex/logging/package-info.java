/**
 * Logging helpers: bounded log text and runtime level control over Logback.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.logging;
