package org.broadinstitute.lincer.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.lincer.exceptions.UserException;
import org.broadinstitute.lincer.utils.LoggingUtils;
import org.broadinstitute.lincer.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loads the {@link LincerConfig} through {@link org.aeonbits.owner}.
 * <p>
 * The user configuration file is given with {@code --lincer-config-file}, which is read from the raw arguments before
 * the tool is built, since argument defaults come from the configuration. Without it the
 * {@link LincerConfig#CONFIG_FILE_VARIABLE_FILE_NAME} source points at an empty file and the remaining sources apply.
 * </p>
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    /**
     * Value of the configuration file variable when no user file was given.
     */
    @VisibleForTesting
    static final String NO_CONFIG_FILE = "/dev/null";

    public static ConfigFactory getInstance() {
        return instance;
    }

    private ConfigFactory() {}

    /**
     * @return the configuration shared by the whole run, loaded on first use
     */
    public LincerConfig getLincerConfig() {
        defaultConfigFileVariable();
        return ConfigCache.getOrCreate(LincerConfig.class);
    }

    /**
     * @return a fresh configuration, loaded from the current sources and not shared with {@link #getLincerConfig()}
     */
    public LincerConfig createLincerConfig() {
        defaultConfigFileVariable();
        return org.aeonbits.owner.ConfigFactory.create(LincerConfig.class);
    }

    // owner leaves an unresolved ${...} in the source path, so the variable always needs a value
    private synchronized void defaultConfigFileVariable() {
        final String variable = LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME;
        if (System.getProperty(variable) != null) {
            logger.debug("Configuration file given as a system property: " + variable + "=" + System.getProperty(variable));
        } else if (System.getenv(variable) != null) {
            logger.debug("Configuration file given in the environment: " + variable + "=" + System.getenv(variable));
        } else if (org.aeonbits.owner.ConfigFactory.getProperty(variable) == null) {
            org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_CONFIG_FILE);
        }
    }

    /**
     * Finds the value of {@code configFileOption} in raw command-line arguments. The file itself is not checked.
     *
     * @return the configuration file name, or {@code null} if the option is absent
     * @throws UserException.BadInput if the option is not followed by a value
     */
    public static String getConfigFilenameFromArgs(final String[] args, final String configFileOption) {
        Utils.nonNull(args, "args");
        Utils.nonNull(configFileOption, "config file option");
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals(configFileOption)) {
                if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                    return args[i + 1];
                }
                throw new UserException.BadInput("No configuration file given after " + configFileOption);
            }
        }
        return null;
    }

    /**
     * Points the configuration at the file given with {@code configFileOption}, if any, and loads it.
     */
    public synchronized LincerConfig initializeFromCommandLineArgs(final String[] args, final String configFileOption) {
        final String configFileName = getConfigFilenameFromArgs(args, configFileOption);
        if (configFileName != null) {
            org.aeonbits.owner.ConfigFactory.setProperty(LincerConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName);
        }
        return getLincerConfig();
    }

    /**
     * Logs every configuration key and its value, sorted by key, at {@code logLevel}.
     */
    public static void logConfigFields(final LincerConfig config, final Log.LogLevel logLevel) {
        Utils.nonNull(config, "config");
        Utils.nonNull(logLevel, "log level");
        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if (!logger.isEnabled(level)) {
            return;
        }
        final List<String> keys = new ArrayList<>(config.propertyNames());
        Collections.sort(keys);
        logger.log(level, "Configuration values:");
        for (final String key : keys) {
            logger.log(level, "\t" + key + " = " + config.getProperty(key));
        }
    }
}
