package com.edgelet.internal.microhttp;

/**
 * Key-value pair that makes up part of a structured transport log message.
 */
public record LogEntry(String key, String value) {
}
