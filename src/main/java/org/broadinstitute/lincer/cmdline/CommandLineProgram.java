package org.broadinstitute.lincer.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLinePluginDescriptor;
import org.broadinstitute.barclay.argparser.CommandLinePluginProvider;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.LoggingUtils;
import org.broadinstitute.lincer.utils.Utils;
import org.broadinstitute.lincer.utils.config.ConfigFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Base class of lincer's command-line tools.
 * <p>
 * A tool declares its arguments as fields annotated with {@link Argument} or
 * {@link org.broadinstitute.barclay.argparser.PositionalArguments}, may check them together in
 * {@link #customCommandLineValidation()}, and does its work in {@link #doWork()}, between the
 * {@link #onStartup()} and {@link #onShutdown()} hooks.
 * </p>
 * Arguments shared by all tools (temporary directory, verbosity, configuration file) are declared here.
 */
public abstract class CommandLineProgram implements CommandLinePluginProvider {

    // an instance field so that messages carry the name of the concrete tool
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @Argument(fullName = StandardArgumentDefinitions.TMP_DIR_NAME, common = true, optional = true,
            doc = "Directory for the temporary working directories of the external tools")
    public File tmpDir;

    @ArgumentCollection(doc = "Special arguments of the argument parser (help, version, argument files)")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
            common = true, optional = true, doc = "Logging verbosity")
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, common = true, optional = true,
            doc = "Do not log the startup banner nor print the elapsed time")
    public Boolean QUIET = false;

    // Read by Main before the tool is built, since argument defaults come from the configuration.
    // Declared here so that the parser accepts it and the usage lists it.
    @Argument(fullName = StandardArgumentDefinitions.LINCER_CONFIG_FILE_OPTION, common = true, optional = true,
            doc = "Properties file overriding the lincer configuration defaults")
    public String LINCER_CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    private String commandLine;

    protected void onStartup() {}

    /**
     * @return the result of the tool, or {@code null}
     */
    protected abstract Object doWork();

    /**
     * Always runs after {@link #doWork()}, even if it threw.
     */
    protected void onShutdown() {}

    /**
     * @return an array of error messages, or {@code null} if the arguments are consistent
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} and runs the tool.
     *
     * @return the result of {@link #doWork()}, or {@code 0} if only help or the version was requested
     * @throws CommandLineException if the arguments are invalid
     */
    public Object instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 0;
        }
        return instanceMainPostParseArgs();
    }

    /**
     * @return {@code false} if an informational argument such as {@code --help} was given
     * @throws CommandLineException if parsing or {@link #customCommandLineValidation()} fails
     */
    protected final boolean parseArgs(final String[] argv) {
        final boolean run = getCommandLineParser().parseArguments(System.err, argv);
        commandLine = getCommandLineParser().getCommandLine();
        if (!run) {
            return false;
        }
        final String[] errors = customCommandLineValidation();
        if (errors != null) {
            throw new CommandLineException("Command Line Validation failed: " + String.join(", ", errors));
        }
        return true;
    }

    public Object instanceMainPostParseArgs() {
        LoggingUtils.setLoggingLevel(VERBOSITY);
        useTmpDir(tmpDir == null ? new File(System.getProperty("java.io.tmpdir")) : tmpDir);

        final ZonedDateTime start = ZonedDateTime.now();
        if (!QUIET) {
            logStartup(start);
        }
        try {
            onStartup();
            return doWork();
        } finally {
            onShutdown();
            if (!QUIET) {
                final double minutes = Duration.between(start, ZonedDateTime.now()).toMillis() / 60000.0;
                System.err.println(String.format("[%s] %s done. Elapsed time: %.2f minutes.",
                        Utils.getDateTimeForDisplay(ZonedDateTime.now()), getClass().getSimpleName(), minutes));
            }
        }
    }

    private void useTmpDir(final File directory) {
        final Path path = directory.toPath().toAbsolutePath();
        if (!Files.isDirectory(path) || !Files.isReadable(path) || !Files.isWritable(path)) {
            throw new UserException.BadTempDir(path, "should be an existing directory with read and write access", null);
        }
        tmpDir = path.toFile();
        System.setProperty("java.io.tmpdir", path.toString());
    }

    private void logStartup(final ZonedDateTime start) {
        final String rule = Utils.dupChar('-', 60);
        logger.info(rule);
        logger.info(String.format("%s %s v%s", getToolkitName(), getClass().getSimpleName(), getVersion()));
        logger.info(String.format("Java runtime: %s v%s on %s %s",
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version"),
                System.getProperty("os.name"), System.getProperty("os.arch")));
        logger.info("Start Date/Time: " + Utils.getDateTimeForDisplay(start));
        logger.info(rule);
        ConfigFactory.logConfigFields(ConfigFactory.getInstance().getLincerConfig(), Log.LogLevel.DEBUG);
    }

    /**
     * @return the Implementation-Title of the jar manifest, or "lincer" when run from classes
     */
    protected String getToolkitName() {
        final String title = getClass().getPackage().getImplementationTitle();
        return title == null ? "lincer" : title;
    }

    /**
     * @return the Implementation-Version of the jar manifest, or "Unavailable"
     */
    public String getVersion() {
        final String version = getClass().getPackage().getImplementationVersion();
        return version == null ? "Unavailable" : version;
    }

    /**
     * Lincer tools take no plugins.
     */
    @Override
    public List<? extends CommandLinePluginDescriptor<?>> getPluginDescriptors() {
        return Collections.emptyList();
    }

    /**
     * @return the parsed command line, or {@code null} before parsing
     */
    public final String getCommandLine() {
        return commandLine;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    @VisibleForTesting
    public final CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = new CommandLineArgumentParser(this, getPluginDescriptors(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
