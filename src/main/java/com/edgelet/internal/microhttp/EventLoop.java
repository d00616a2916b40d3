package com.edgelet.internal.microhttp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP/1.x server: binds one listening socket and runs {@link Options#listenerCount()} listener
 * threads that all accept from it, so incoming connections spread across them.
 */
public class EventLoop {

    private final Logger logger;
    private final ServerSocketChannel serverSocketChannel;
    private final AtomicBoolean stop;
    private final List<ListenerLoop> listenerLoops;

    public EventLoop(Options options, Handler handler) throws IOException {
        this(options, NoopLogger.instance(), handler);
    }

    public EventLoop(Options options, Logger logger, Handler handler) throws IOException {
        if (options.listenerCount() < 1) {
            throw new IllegalArgumentException("Listener count must be > 0");
        }

        this.logger = logger;
        this.stop = new AtomicBoolean();
        this.listenerLoops = new ArrayList<>(options.listenerCount());

        InetSocketAddress address = options.host() == null
                ? new InetSocketAddress(options.port()) // wildcard address
                : new InetSocketAddress(options.host(), options.port());

        serverSocketChannel = ServerSocketChannel.open();

        try {
            if (options.reuseAddr()) {
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, options.acceptLength());

            AtomicLong connectionCounter = new AtomicLong();
            for (int i = 0; i < options.listenerCount(); i++) {
                listenerLoops.add(new ListenerLoop(i + 1, options, logger, handler, serverSocketChannel, connectionCounter, stop));
            }
        } catch (IOException | RuntimeException e) {
            CloseUtils.closeQuietly(serverSocketChannel);
            throw e;
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was {@code 0}
     */
    public int getPort() throws IOException {
        return serverSocketChannel.getLocalAddress() instanceof InetSocketAddress a ? a.getPort() : -1;
    }

    public void start() {
        listenerLoops.forEach(ListenerLoop::start);
        if (logger.enabled()) {
            logger.log(
                    new LogEntry("event", "event_loop_start"),
                    new LogEntry("listeners", Integer.toString(listenerLoops.size())));
        }
    }

    /**
     * Signals every listener to finish. Returns immediately; use {@link #join()} to wait.
     */
    public void stop() {
        stop.set(true);
        listenerLoops.forEach(ListenerLoop::wakeup);
    }

    public boolean isStopped() {
        return stop.get();
    }

    public void join() throws InterruptedException {
        try {
            for (ListenerLoop listenerLoop : listenerLoops) {
                listenerLoop.join();
            }
        } finally {
            CloseUtils.closeQuietly(serverSocketChannel);
        }
    }

    int numConnections() {
        int total = 0;
        for (ListenerLoop listenerLoop : listenerLoops) {
            total += listenerLoop.numConnections();
        }
        return total;
    }
}
