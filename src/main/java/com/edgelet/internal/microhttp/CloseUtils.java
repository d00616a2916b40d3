package com.edgelet.internal.microhttp;

import java.io.Closeable;
import java.io.IOException;

final class CloseUtils {

    private CloseUtils() {
    }

    // Used on paths that are already tearing a connection down, where a second failure adds nothing
    static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException ignored) {
            // Nothing more can be done for this channel
        }
    }

}
