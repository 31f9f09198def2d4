// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.error;

import java.util.List;

/**
 * Thrown when a token configuration is missing required values or cannot be read.
 *
 * @since 0.1.0
 */
public final class ConfigException extends WarrantException {

    public ConfigException(final String message) {
        super(message);
    }

    public ConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * One or more required settings are missing or out of range.
     *
     * @param problems one entry per offending setting
     * @return the exception
     */
    public static ConfigException invalid(final List<String> problems) {
        return new ConfigException("Invalid token configuration: " + String.join(", ", problems));
    }
}
