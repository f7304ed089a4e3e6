/**
 * Configuration loading and validation.
 *
 * <p>
 * YAML is read by {@link com.backupinsight.core.config.ConfigLoader} into an
 * {@link com.backupinsight.core.config.AnalysisConfig}; invalid values are
 * reported once, as an
 * {@link com.backupinsight.core.config.InvalidConfigurationException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.backupinsight.core.config;
