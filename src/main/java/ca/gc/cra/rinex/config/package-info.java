/**
 * Decoder configuration (YAML and key/value) and the composition root that wires grammars, metrics and
 * use cases.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.config;
