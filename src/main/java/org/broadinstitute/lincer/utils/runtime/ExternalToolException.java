package org.broadinstitute.lincer.utils.runtime;

import org.broadinstitute.lincer.exceptions.UserException;

/**
 * Thrown when an external tool cannot be run, exits with a non-zero status or does not produce the
 * artifact it is expected to produce.
 */
public class ExternalToolException extends UserException {
    private static final long serialVersionUID = 0L;

    private final String toolName;

    public ExternalToolException(final String toolName, final String message) {
        super(String.format("External tool %s failed: %s", toolName, message));
        this.toolName = toolName;
    }

    public ExternalToolException(final String toolName, final String message, final Throwable cause) {
        super(String.format("External tool %s failed: %s", toolName, message), cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
