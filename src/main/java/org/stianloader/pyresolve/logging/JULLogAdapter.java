package org.stianloader.pyresolve.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    static String formatMessage(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder();
        int head = 0;
        int trailingThrowable = (args.length != 0 && args[args.length - 1] instanceof Throwable) ? 1 : 0;
        int argIndex = 0;
        for (; argIndex < args.length - trailingThrowable; argIndex++) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, head, placeholder).append(Objects.toString(args[argIndex]));
            head = placeholder + 2;
        }
        builder.append(message, head, message.length());
        for (; argIndex < args.length - trailingThrowable; argIndex++) {
            builder.append(' ').append(Objects.toString(args[argIndex]));
        }
        if (trailingThrowable != 0) {
            StringWriter sw = new StringWriter();
            ((Throwable) args[args.length - 1]).printStackTrace(new PrintWriter(sw));
            builder.append('\n').append(sw);
        }
        return builder.toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.formatMessage(message, args));
        }
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public boolean isDebugEnabled(@NotNull Class<?> clazz) {
        return Logger.getLogger(clazz.getName()).isLoggable(Level.FINE);
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
