package org.stianloader.pyresolve.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used throughout pyresolve.
 *
 * <p>pyresolve does not hard-depend on SLF4J. If SLF4J is present on the classpath, log messages are routed
 * to it; otherwise they end up in {@link java.util.logging.Logger JUL}. Embedders that want the resolver's
 * output elsewhere (for example in a progress display) can install their own adapter through
 * {@link #setDefaultLogger(LoggingAdapter)}.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a placeholder are appended to the message,
 * leftover placeholders are kept verbatim. If the last argument is a {@link Throwable} its stacktrace is logged.
 */
public abstract class LoggingAdapter {

    @NotNull
    static volatile LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);

    /**
     * Whether debug messages emitted on behalf of the given class would reach any sink.
     * Used to avoid building expensive debug output (for example conflict chains) needlessly.
     *
     * @param clazz The class on whose behalf a message would be logged
     * @return True if debug output is enabled
     */
    public abstract boolean isDebugEnabled(@NotNull Class<?> clazz);

    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
