package org.fireup.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colours the wrapped pattern by log level, used as
 * {@code %levelColor(...)} in {@code logback.xml}.
 *
 * <p>Colours: ERROR red, WARN yellow, INFO blue, DEBUG grey, TRACE uncoloured.
 * Setting the {@code NO_COLOR} environment variable disables colouring.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String ANSI_RESET = "\u001B[0m";
    static final String ANSI_RED = "\u001B[31m";
    static final String ANSI_YELLOW = "\u001B[33m";
    static final String ANSI_BLUE = "\u001B[34m";
    static final String ANSI_GREY = "\u001B[90m";

    private final boolean enabled;

    public LogLevelHighlightConverter() {
        this(System.getenv("NO_COLOR") == null);
    }

    LogLevelHighlightConverter(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String colour = enabled ? colourFor(event.getLevel()) : null;
        return colour == null ? in : colour + in + ANSI_RESET;
    }

    static String colourFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT -> ANSI_GREY;
            default -> null;
        };
    }
}
