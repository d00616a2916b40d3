package com.edgelet.internal.microhttp;

/**
 * One HTTP header line. Repeated headers are separate instances.
 */
public record Header(String name, String value) {
}
