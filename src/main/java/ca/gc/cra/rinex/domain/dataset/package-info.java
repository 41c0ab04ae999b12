/**
 * Labeled-array output model: the incremental {@link ca.gc.cra.rinex.domain.dataset.DatasetBuilder},
 * the finalized {@link ca.gc.cra.rinex.domain.dataset.RinexDataset}, and recoverable decode warnings.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rinex.domain.dataset;
