package com.edgelet.internal.microhttp;

/**
 * Structured, connection-level diagnostics sink for the transport.
 * Callers check {@link #enabled()} before building entries.
 */
public interface Logger {

    boolean enabled();

    void log(LogEntry... entries);

    void log(Exception e, LogEntry... entries);

}
