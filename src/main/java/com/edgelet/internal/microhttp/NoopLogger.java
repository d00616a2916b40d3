package com.edgelet.internal.microhttp;

/**
 * {@link Logger} that discards everything.
 */
public class NoopLogger implements Logger {

    private static final NoopLogger INSTANCE = new NoopLogger();

    public static Logger instance() {
        return INSTANCE;
    }

    @Override
    public boolean enabled() {
        return false;
    }

    @Override
    public void log(LogEntry... entries) {
        // No-op
    }

    @Override
    public void log(Exception e, LogEntry... entries) {
        // No-op
    }

}
