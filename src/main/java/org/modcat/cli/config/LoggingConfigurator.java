package org.modcat.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logger levels from the {@code logging.levels} block to Logback:
 * <pre>
 * logging.levels {
 *   "org.modcat.graph" = DEBUG
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String LEVELS_PATH = "logging.levels";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LEVELS_PATH)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getConfig(LEVELS_PATH).entrySet()) {
            String loggerName = String.join(".", ConfigUtil.splitPath(entry.getKey()));
            setLevel(loggerName, entry.getValue().unwrapped().toString());
        }
    }

    /**
     * Sets the level of a logger; {@code ROOT} addresses the root logger.
     */
    public static void setLevel(String loggerName, String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            log.warn("Logback is not the active SLF4J backend, ignoring level {} for {}", level, loggerName);
            return;
        }
        ((LoggerContext) factory).getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
    }
}
