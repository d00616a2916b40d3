package com.edgelet.internal.microhttp;

import java.time.Duration;

/**
 * Transport settings. Mutable and fluent; hand a fully configured instance to {@link EventLoop}.
 */
public class Options {

    private String host;
    private int port = 8080;
    private int listenerCount = 1;
    private boolean reuseAddr = true;
    private Duration resolution = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private int readBufferSize = 1_024 * 64;
    private int acceptLength = 0;
    private int maxRequestSize = 1_024 * 1_024 * 10;
    private String threadNamePrefix = "listener";

    /**
     * @return the bind address, or {@code null} for the wildcard address
     */
    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int listenerCount() {
        return listenerCount;
    }

    public boolean reuseAddr() {
        return reuseAddr;
    }

    /**
     * Upper bound on how long a listener blocks in {@code select}; also the granularity of request timeouts.
     */
    public Duration resolution() {
        return resolution;
    }

    /**
     * Time allowed for a connection to deliver one complete request.
     */
    public Duration requestTimeout() {
        return requestTimeout;
    }

    public int readBufferSize() {
        return readBufferSize;
    }

    public int acceptLength() {
        return acceptLength;
    }

    public int maxRequestSize() {
        return maxRequestSize;
    }

    public String threadNamePrefix() {
        return threadNamePrefix;
    }

    public Options withHost(String host) {
        this.host = host;
        return this;
    }

    public Options withPort(int port) {
        this.port = port;
        return this;
    }

    public Options withListenerCount(int listenerCount) {
        this.listenerCount = listenerCount;
        return this;
    }

    public Options withReuseAddr(boolean reuseAddr) {
        this.reuseAddr = reuseAddr;
        return this;
    }

    public Options withResolution(Duration resolution) {
        this.resolution = resolution;
        return this;
    }

    public Options withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public Options withReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
        return this;
    }

    public Options withAcceptLength(int acceptLength) {
        this.acceptLength = acceptLength;
        return this;
    }

    public Options withMaxRequestSize(int maxRequestSize) {
        this.maxRequestSize = maxRequestSize;
        return this;
    }

    public Options withThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }
}
