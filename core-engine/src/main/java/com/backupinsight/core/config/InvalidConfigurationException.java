package com.backupinsight.core.config;

/**
 * Raised when analysis configuration holds illegal values.
 *
 * <p>
 * Only thrown while configuration is loaded or a component is constructed,
 * never during a computation.
 * </p>
 *
 * @since 1.0.0
 */
public class InvalidConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
