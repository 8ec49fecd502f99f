package com.williamcallahan.scholarly_dashboard.util;

import org.slf4j.Logger;

/**
 * Logs a failure with its cause appended as the last argument, so SLF4J prints the stack
 * trace after the formatted message.
 */
public final class LoggingUtils {
    private LoggingUtils() {
    }

    /** For failures that end the current operation. */
    public static void error(Logger logger, Throwable cause, String pattern, Object... args) {
        if (logger != null && pattern != null) {
            logger.error(pattern, withCause(cause, args));
        }
    }

    /** For failures the caller recovers from, such as a skipped record. */
    public static void warn(Logger logger, Throwable cause, String pattern, Object... args) {
        if (logger != null && pattern != null) {
            logger.warn(pattern, withCause(cause, args));
        }
    }

    static Object[] withCause(Throwable cause, Object... args) {
        int size = args == null ? 0 : args.length;
        if (cause == null) {
            return size == 0 ? new Object[0] : args.clone();
        }
        Object[] combined = new Object[size + 1];
        if (size > 0) {
            System.arraycopy(args, 0, combined, 0, size);
        }
        combined[size] = cause;
        return combined;
    }
}
