package org.broadinstitute.lincer.exceptions;

/**
 * A failure of lincer itself rather than of its inputs, e.g. an interrupted run or an unreadable tool stream.
 */
public class LincerException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public LincerException(final String message) {
        super(message);
    }

    public LincerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
