package com.edgelet.internal.microhttp;

/**
 * Receives each parsed request on the listener thread that read it.
 * <p>
 * Implementations must not block: long-running work belongs on another thread, which answers
 * through the {@link Exchange} whenever it is ready.
 */
public interface Handler {

    void handle(MicrohttpRequest request, Exchange exchange);

}
