/**
 * Period-over-period comparison of aggregated metrics.
 *
 * @since 1.0.0
 */
package com.backupinsight.core.comparison;
