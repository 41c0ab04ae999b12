/**
 * Argument validation helpers shared by configuration parsing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.validation;
