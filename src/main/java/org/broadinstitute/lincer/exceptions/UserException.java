package org.broadinstitute.lincer.exceptions;

import org.broadinstitute.lincer.cmdline.StandardArgumentDefinitions;

import java.nio.file.Path;

/**
 * A failure the user can fix: a missing or malformed input, an unwritable output, a bad argument value.
 * Reported without a stack trace and with exit value 2.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException(final String message) {
        super(message);
    }

    public UserException(final String message, final Throwable cause) {
        super(message, cause);
    }

    protected static String describe(final Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    }

    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final Path file, final String reason) {
            super(String.format("Could not read %s: %s", file.toAbsolutePath(), reason));
        }

        public CouldNotReadInputFile(final Path file, final String reason, final Throwable cause) {
            super(String.format("Could not read %s: %s", file.toAbsolutePath(), reason), cause);
        }

        public CouldNotReadInputFile(final Path file, final Exception cause) {
            this(file, describe(cause), cause);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final Path file, final String reason) {
            super(String.format("Could not write %s: %s", file.toAbsolutePath(), reason));
        }

        public CouldNotCreateOutputFile(final Path file, final Exception cause) {
            super(String.format("Could not write %s: %s", file.toAbsolutePath(), describe(cause)), cause);
        }
    }

    /**
     * An argument or input value that is well formed but unusable, e.g. an empty sample sheet.
     */
    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(final String message) {
            super("Bad input: " + message);
        }
    }

    /**
     * An annotation file or table that cannot be parsed.
     */
    public static class MalformedFile extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedFile(final String message) {
            super("Malformed input: " + message);
        }

        public MalformedFile(final Path file, final long lineNumber, final String message) {
            super(String.format("File %s is malformed at line %d: %s", file, lineNumber, message));
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        private static final String MESSAGE_FORMAT = "Cannot use the temporary directory %s (%s). Give another one with --"
                + StandardArgumentDefinitions.TMP_DIR_NAME + ".";

        public BadTempDir(final String message, final Throwable cause) {
            this(Path.of(System.getProperty("java.io.tmpdir")), message, cause);
        }

        public BadTempDir(final Path directory, final String message, final Throwable cause) {
            super(String.format(MESSAGE_FORMAT, directory, message), cause);
        }
    }
}
