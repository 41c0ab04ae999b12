/**
 * Thread pool factories.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.infrastructure.exec;
