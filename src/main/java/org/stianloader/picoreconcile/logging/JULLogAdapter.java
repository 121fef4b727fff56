package org.stianloader.picoreconcile.logging;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    @Contract(pure = true)
    static String format(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int head = 0;
        for (Object arg : args) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                builder.append(message, head, message.length()).append(' ').append(Objects.toString(arg));
                head = message.length();
            } else {
                builder.append(message, head, placeholder).append(Objects.toString(arg));
                head = placeholder + 2;
            }
        }
        return builder.append(message, head, message.length()).toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (!logger.isLoggable(level)) {
            return;
        }
        Throwable thrown = null;
        if (args.length != 0 && args[args.length - 1] instanceof Throwable && JULLogAdapter.placeholders(message) < args.length) {
            // Trailing throwable without a placeholder, log its stacktrace instead of appending it
            thrown = (Throwable) args[args.length - 1];
            args = Arrays.copyOf(args, args.length - 1);
        }
        logger.log(level, JULLogAdapter.format(message, args), thrown);
    }

    private static int placeholders(@NotNull String message) {
        int count = 0;
        for (int i = message.indexOf("{}"); i != -1; i = message.indexOf("{}", i + 2)) {
            count++;
        }
        return count;
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
