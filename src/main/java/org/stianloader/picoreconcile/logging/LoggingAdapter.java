package org.stianloader.picoreconcile.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade of picoreconcile. Compatibility checks happen deep within dependency resolution
 * and should never fail on odd version strings found in the wild, so such strings are reported
 * through this facade instead.
 *
 * <p>SLF4J is used as the log sink if it is present on the classpath, otherwise messages are
 * sent to {@link java.util.logging.Logger JUL}. Messages use SLF4J-style "{}" placeholders.
 * Arguments without a matching placeholder are appended to the message. Placeholders without
 * a matching argument are left as-is.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter currentInstance;

    // picoreconcile only ever logs from pure parsing code, so the sink is chosen once and never per call
    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    /**
     * Replaces the logger used by picoreconcile, for example in order to capture
     * warnings emitted while parsing version constraints.
     *
     * @param instance The new logger
     */
    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
