package org.stianloader.picoreconcile.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

/**
 * Forwards to SLF4J. Only warnings about unparseable version constraints and debug output
 * about unknown policy names or disjoint intervals pass through here.
 */
class SLF4JLogAdapter extends LoggingAdapter {

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).debug(message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        LoggerFactory.getLogger(clazz).warn(message, args);
    }
}
