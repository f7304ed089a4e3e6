/**
 * Period bucketing and per-bucket statistics.
 *
 * @since 1.0.0
 */
package com.backupinsight.core.aggregation;
