package org.broadinstitute.lincer.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Verbosity handling.
 * <p>
 * The {@code --verbosity} argument is an htsjdk {@link Log.LogLevel}, since log4j levels are not an enum the
 * argument parser can bind. Setting it applies to htsjdk and to the log4j configuration of lincer.
 * </p>
 */
public final class LoggingUtils {

    private static final BiMap<Log.LogLevel, Level> LEVELS = EnumHashBiMap.create(Log.LogLevel.class);
    static {
        LEVELS.put(Log.LogLevel.ERROR, Level.ERROR);
        LEVELS.put(Log.LogLevel.WARNING, Level.WARN);
        LEVELS.put(Log.LogLevel.INFO, Level.INFO);
        LEVELS.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    private LoggingUtils() {}

    static Log.LogLevel levelFromLog4jLevel(final Level level) {
        return LEVELS.inverse().get(level);
    }

    public static Level levelToLog4jLevel(final Log.LogLevel level) {
        return LEVELS.get(level);
    }

    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "verbosity");
        Log.setGlobalLogLevel(verbosity);

        final LoggerContext context = (LoggerContext) LogManager.getContext(false);
        // the configuration that governs lincer's loggers, usually the root one
        final LoggerConfig config = context.getConfiguration().getLoggerConfig(LoggingUtils.class.getName());
        config.setLevel(levelToLog4jLevel(verbosity));
        context.updateLoggers();
    }
}
