package org.modcat.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter for log level coloring in the {@code COLOR} console format.
 *
 * <p>Colors:
 * <ul>
 *   <li>ERROR - Red</li>
 *   <li>WARN - Yellow (cycle reports, unreadable configuration)</li>
 *   <li>INFO - Green (written artifacts)</li>
 *   <li>DEBUG/TRACE - Dimmed (edges, exclusions)</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_DIM = "\u001B[2m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        return colorFor(event.getLevel()) + in + ANSI_RESET;
    }

    static String colorFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_GREEN;
            default -> ANSI_DIM;
        };
    }
}
