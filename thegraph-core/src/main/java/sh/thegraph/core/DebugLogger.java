// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.thegraph.core.GraphDebug.Category;

/**
 * Writes debug lines for enabled {@link Category categories}.
 *
 * <p>Each category has its own SLF4J logger under {@code sh.thegraph.debug}
 * ({@code sh.thegraph.debug.query}, {@code sh.thegraph.debug.page}), so appenders can route page
 * progress apart from transport traffic. Lines pass through {@link LogSanitizer} first and bearer
 * tokens never reach the appenders.
 */
public final class DebugLogger {

    /** Parent of the per-category loggers. */
    public static final String LOGGER_NAME = "sh.thegraph.debug";

    private static final Map<Category, Logger> LOGGERS = new EnumMap<>(Category.class);

    static {
        for (Category category : Category.values()) {
            LOGGERS.put(category, LoggerFactory.getLogger(LOGGER_NAME + "." + category.name().toLowerCase(Locale.ROOT)));
        }
    }

    private DebugLogger() {
    }

    /**
     * Logs {@code message}, formatted with {@code args} when any are given.
     */
    public static void log(final Category category, final String message, final Object... args) {
        if (!GraphDebug.isEnabled(category)) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOGGERS.get(category).info(LogSanitizer.sanitize(formatted));
    }
}
