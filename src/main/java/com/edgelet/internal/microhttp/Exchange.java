package com.edgelet.internal.microhttp;

/**
 * Write side of one request/response exchange on a connection. May be used from any thread.
 * <p>
 * Either {@link #respond(MicrohttpResponse)} is called once, or {@link #beginStream(MicrohttpResponse)}
 * followed by any number of {@link #writeChunk(byte[])} calls and one {@link #endStream()} or {@link #abortStream()}.
 * Everything written is delivered to the socket in call order.
 */
public interface Exchange {

    void respond(MicrohttpResponse response);

    /**
     * Sends the status line and headers of {@code head}; its body is ignored.
     */
    void beginStream(MicrohttpResponse head);

    /**
     * @return {@code false} if the connection is already closed and the chunk was dropped
     */
    boolean writeChunk(byte[] chunk);

    void endStream();

    /**
     * Flushes the chunks written so far, then closes the connection without the terminating chunk.
     */
    void abortStream();

    boolean isOpen();

}
