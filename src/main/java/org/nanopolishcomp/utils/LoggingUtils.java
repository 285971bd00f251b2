package org.nanopolishcomp.utils;

import com.google.common.collect.BiMap;
import com.google.common.collect.EnumHashBiMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;

/**
 * Logging utilities.
 *
 * Tools use the htsjdk Log.LogLevel enum as the type for the verbosity command line argument, since each log4j
 * level is a static object and there is no enum the argument parser can bind to. We convert back and forth
 * between that enum and the log4j namespace as necessary.
 */
public final class LoggingUtils {

    private LoggingUtils() {}

    // Map between the logging level used on the command line (the htsjdk Log.LogLevel enum)
    // and the log4j log Level values.
    private static final BiMap<Log.LogLevel, Level> loggingLevelNamespaceMap;
    static {
        loggingLevelNamespaceMap = EnumHashBiMap.create(Log.LogLevel.class);
        loggingLevelNamespaceMap.put(Log.LogLevel.ERROR, Level.ERROR);
        loggingLevelNamespaceMap.put(Log.LogLevel.WARNING, Level.WARN);
        loggingLevelNamespaceMap.put(Log.LogLevel.INFO, Level.INFO);
        loggingLevelNamespaceMap.put(Log.LogLevel.DEBUG, Level.DEBUG);
    }

    // Package-private for unit test access
    static Log.LogLevel levelFromLog4jLevel(Level log4jLevel) {
        return loggingLevelNamespaceMap.inverse().get(log4jLevel);
    }

    /**
     * Converts an htsjdk log level to a log4j log level.
     * @param level {@link Log.LogLevel} to convert to a Log4J {@link Level}.
     * @return The {@link Level} that corresponds to the given {@code level}.
     */
    public static Level levelToLog4jLevel(Log.LogLevel level) {
        return loggingLevelNamespaceMap.get(level);
    }

    /**
     * Propagate the verbosity level to htsjdk and log4j
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "verbosity");

        Log.setGlobalLogLevel(verbosity);

        // propagate the requested level to all loggers associated with our logging configuration
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        final Configuration loggerContextConfig = loggerContext.getConfiguration();
        final LoggerConfig loggerConfig = loggerContextConfig.getLoggerConfig(LoggingUtils.class.getName());

        loggerConfig.setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }
}
