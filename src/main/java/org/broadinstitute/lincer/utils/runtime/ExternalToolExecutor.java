package org.broadinstitute.lincer.utils.runtime;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.exceptions.LincerException;
import org.broadinstitute.lincer.utils.Utils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Base class for the wrappers of external command-line tools (the transcript comparator and the assembly merger).
 * <p>
 * A run blocks until the tool exits. There is no timeout. The tool gets an empty standard input, and the first
 * {@value #CAPTURED_OUTPUT_LIMIT} bytes of its standard output and error are kept for the error message of a failed
 * run and echoed at DEBUG level.
 * </p>
 */
public abstract class ExternalToolExecutor {
    private static final Logger logger = LogManager.getLogger(ExternalToolExecutor.class);

    public static final int CAPTURED_OUTPUT_LIMIT = 64 * 1024;

    private static final ExecutorService outputReaders = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("lincer-tool-output-%d").setDaemon(true).build());

    protected final String externalExecutableName;    // e.g. "cuffcompare", or a path to it
    private final File externalExecutablePath;

    private String[] commandLineArgs;

    /**
     * @param externalExecutableName name of the program, searched for on the PATH, or a path to it
     */
    public ExternalToolExecutor(final String externalExecutableName) {
        Utils.nonEmpty(externalExecutableName, "external executable name");
        this.externalExecutableName = externalExecutableName;
        this.externalExecutablePath = which(externalExecutableName);
    }

    /**
     * @return true if the executable was found
     */
    public boolean externalExecutableExists() {
        return externalExecutablePath != null;
    }

    /**
     * @return a readable rendering of the last command line, for error messages
     */
    public abstract String getApproximateCommandLine();

    /**
     * Runs the executable with {@code arguments} in {@code workingDirectory}.
     *
     * @return the output of the run, which exited with status 0
     * @throws ExternalToolException if the executable is missing, cannot be started or exits with a non-zero status
     */
    protected ToolOutput execute(final File workingDirectory, final String... arguments) {
        Utils.nonNull(workingDirectory, "working directory");
        Utils.nonNull(arguments, "arguments");
        if (!externalExecutableExists()) {
            throw new ExternalToolException(externalExecutableName, String.format(
                    "executable not found. Add its directory to the PATH or give its full path (%s)", externalExecutableName));
        }

        final List<String> command = new ArrayList<>(arguments.length + 1);
        command.add(externalExecutablePath.getAbsolutePath());
        command.addAll(Arrays.asList(arguments));
        commandLineArgs = command.toArray(new String[0]);
        logger.debug("Running in " + workingDirectory + ": " + String.join(" ", commandLineArgs));

        final Process process;
        try {
            process = new ProcessBuilder(command).directory(workingDirectory).start();
            process.getOutputStream().close();
        } catch (final IOException e) {
            throw new ExternalToolException(externalExecutableName, "could not be started: " + e.getMessage(), e);
        }
        final Future<String> stdout = outputReaders.submit(() -> capture(process.getInputStream()));
        final Future<String> stderr = outputReaders.submit(() -> capture(process.getErrorStream()));

        final ToolOutput output;
        try {
            final int exitValue = process.waitFor();
            output = new ToolOutput(exitValue, stdout.get(), stderr.get());
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new LincerException("Interrupted while running " + externalExecutableName, e);
        } catch (final ExecutionException e) {
            throw new LincerException("Could not read the output of " + externalExecutableName, e.getCause());
        }

        if (logger.isDebugEnabled()) {
            logger.debug(externalExecutableName + " exited with " + output.getExitValue());
            output.getStdout().lines().forEach(line -> logger.debug("stdout: " + line));
            output.getStderr().lines().forEach(line -> logger.debug("stderr: " + line));
        }
        if (output.getExitValue() != 0) {
            throw new ExternalToolException(externalExecutableName, getExceptionMessageFromToolError(output));
        }
        return output;
    }

    /**
     * @return the message of a failed run: exit status, command line and, unless already echoed at DEBUG level,
     * the captured output
     */
    public String getExceptionMessageFromToolError(final ToolOutput output) {
        Utils.nonNull(output, "tool output");
        final StringBuilder message = new StringBuilder(String.format("%n%s exited with %d%nCommand Line: %s",
                externalExecutableName, output.getExitValue(),
                String.join(" ", Utils.nonNull(commandLineArgs, "the tool has not been run"))));
        if (!logger.isDebugEnabled()) {
            if (!output.getStdout().isEmpty()) {
                message.append(String.format("%nStdout: %s", output.getStdout()));
            }
            if (!output.getStderr().isEmpty()) {
                message.append(String.format("%nStderr: %s", output.getStderr()));
            }
        }
        return message.toString();
    }

    /**
     * Reads a tool stream to its end, keeping at most {@value #CAPTURED_OUTPUT_LIMIT} bytes.
     */
    private static String capture(final InputStream stream) throws IOException {
        try (final InputStream in = stream) {
            final ByteArrayOutputStream kept = new ByteArrayOutputStream();
            IOUtils.copy(new BoundedInputStream(in, CAPTURED_OUTPUT_LIMIT), kept);
            final long dropped = IOUtils.consume(in);
            final String text = kept.toString(StandardCharsets.UTF_8);
            return dropped == 0 ? text : text + String.format("%n... %d more bytes not shown", dropped);
        }
    }

    /**
     * @return the executable, resolved as a path when it has a directory component and on the PATH otherwise,
     * or {@code null} if it cannot be found
     */
    static File which(final String executable) {
        if (executable.indexOf(File.separatorChar) >= 0) {
            final File file = new File(executable);
            return file.canExecute() ? file.getAbsoluteFile() : null;
        }
        final String path = System.getenv("PATH");
        for (final String directory : StringUtils.split(StringUtils.defaultString(path), File.pathSeparatorChar)) {
            final File file = new File(directory, executable);
            if (file.isFile() && file.canExecute()) {
                return file.getAbsoluteFile();
            }
        }
        return null;
    }

    /**
     * Exit status and captured output of a finished run.
     */
    public static final class ToolOutput {
        private final int exitValue;
        private final String stdout;
        private final String stderr;

        ToolOutput(final int exitValue, final String stdout, final String stderr) {
            this.exitValue = exitValue;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        public int getExitValue() {
            return exitValue;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderr() {
            return stderr;
        }
    }
}
