package com.edgelet.internal.microhttp;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One listener thread. It accepts connections from the shared server socket through its own
 * selector and then serves every connection it accepted: reading and parsing requests, handing
 * them to the {@link Handler}, and writing responses. Responses and stream chunks produced on
 * other threads are queued as tasks and written by this thread, in order.
 *
 * <pre>
 *            read partial          pipelined request
 *              +-----+          +--------------------+
 *              |     v          v                    |
 *  accept  +----------+  parsed  +----------+  written  +----------+  non-persistent  +--------+
 * -------->| READING  +--------->| HANDLING +---------->| WRITING  +----------------->| CLOSED |
 *          +----------+          +----+-----+           +----+-----+                  +--------+
 *               ^                     | stream chunks        |
 *               |                     +--------------------->|
 *               +--------------------------------------------+
 *                              written, persistent
 * </pre>
 */
class ListenerLoop {

    private final Options options;
    private final Logger logger;
    private final Handler handler;
    private final ServerSocketChannel serverSocketChannel;
    private final AtomicLong connectionCounter;
    private final AtomicBoolean stop;

    private final Scheduler timeoutQueue;
    private final Queue<Runnable> taskQueue;
    private final ByteBuffer buffer;
    private final Selector selector;
    private final Thread thread;
    private final AtomicInteger connectionCount;

    ListenerLoop(
            int index,
            Options options,
            Logger logger,
            Handler handler,
            ServerSocketChannel serverSocketChannel,
            AtomicLong connectionCounter,
            AtomicBoolean stop) throws IOException {
        this.options = options;
        this.logger = logger;
        this.handler = handler;
        this.serverSocketChannel = serverSocketChannel;
        this.connectionCounter = connectionCounter;
        this.stop = stop;

        connectionCount = new AtomicInteger();
        timeoutQueue = new Scheduler();
        taskQueue = new ConcurrentLinkedQueue<>();
        buffer = ByteBuffer.allocateDirect(options.readBufferSize());
        selector = Selector.open();
        serverSocketChannel.register(selector, SelectionKey.OP_ACCEPT);
        thread = new Thread(this::run, options.threadNamePrefix() + "-" + index);
    }

    @FunctionalInterface
    private interface WriteTask {
        void run() throws IOException;
    }

    private class Connection {
        static final String HTTP_1_0 = "HTTP/1.0";
        static final String HTTP_1_1 = "HTTP/1.1";

        static final String HEADER_CONNECTION = "Connection";
        static final String HEADER_CONTENT_LENGTH = "Content-Length";
        static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";

        static final String KEEP_ALIVE = "Keep-Alive";
        static final String CLOSE = "close";
        static final String CHUNKED = "chunked";
        static final String HEAD = "HEAD";

        static final byte[] BAD_REQUEST_RESPONSE =
                "HTTP/1.1 400 Bad Request\r\nConnection: close\r\nContent-Length: 0\r\n\r\n"
                        .getBytes(StandardCharsets.US_ASCII);
        static final byte[] PAYLOAD_TOO_LARGE_RESPONSE =
                "HTTP/1.1 413 Content Too Large\r\nConnection: close\r\nContent-Length: 0\r\n\r\n"
                        .getBytes(StandardCharsets.US_ASCII);
        static final byte[] INTERNAL_SERVER_ERROR_RESPONSE =
                "HTTP/1.1 500 Internal Server Error\r\nConnection: close\r\nContent-Length: 0\r\n\r\n"
                        .getBytes(StandardCharsets.US_ASCII);
        static final byte[] LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

        final SocketChannel socketChannel;
        final SelectionKey selectionKey;
        final ByteTokenizer byteTokenizer;
        final String id;
        final InetSocketAddress remoteAddress;
        final Deque<ByteBuffer> writeQueue;
        final AtomicBoolean closed;
        RequestParser requestParser;
        Cancellable requestTimeoutTask;
        boolean httpOneDotZero;
        boolean keepAlive;
        boolean closeAfterResponse;
        boolean headRequest;
        boolean chunkedStream;
        // Between a parsed request and the last byte of its response leaving the queue
        boolean awaitingResponse;
        // The whole response (including any final chunk) has been queued
        boolean responseQueued;

        private Connection(SocketChannel socketChannel, SelectionKey selectionKey, InetSocketAddress remoteAddress) {
            this.socketChannel = socketChannel;
            this.selectionKey = selectionKey;
            this.remoteAddress = remoteAddress;
            byteTokenizer = new ByteTokenizer();
            id = Long.toString(connectionCounter.getAndIncrement());
            writeQueue = new ArrayDeque<>();
            closed = new AtomicBoolean(false);
            requestParser = new RequestParser(byteTokenizer, remoteAddress);
            requestTimeoutTask = timeoutQueue.schedule(this::onRequestTimeout, options.requestTimeout());
        }

        private void onRequestTimeout() {
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "request_timeout"),
                        new LogEntry("id", id));
            }
            failSafeClose();
        }

        private void onReadable() {
            try {
                doOnReadable();
            } catch (MalformedRequestException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "malformed_request"),
                            new LogEntry("id", id));
                }
                respondAndClose(BAD_REQUEST_RESPONSE);
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "read_error"),
                            new LogEntry("id", id));
                }
                failSafeClose();
            }
        }

        private void doOnReadable() throws IOException {
            buffer.clear();
            int numBytes = socketChannel.read(buffer);
            if (numBytes < 0) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "read_close"),
                            new LogEntry("id", id));
                }
                failSafeClose();
                return;
            }
            buffer.flip();
            byteTokenizer.add(buffer);
            if (requestParser.parse()) {
                onParseRequest();
            } else if (byteTokenizer.size() > options.maxRequestSize()) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "exceed_request_max_close"),
                            new LogEntry("id", id),
                            new LogEntry("request_size", Integer.toString(byteTokenizer.size())));
                }
                respondAndClose(PAYLOAD_TOO_LARGE_RESPONSE);
            }
        }

        private void stopReading() {
            if (selectionKey.isValid() && selectionKey.interestOps() != 0) {
                selectionKey.interestOps(0);
            }
            if (requestTimeoutTask != null) {
                requestTimeoutTask.cancel();
                requestTimeoutTask = null;
            }
        }

        private void respondAndClose(byte[] response) {
            stopReading();
            closeAfterResponse = true;
            awaitingResponse = true;
            responseQueued = true;
            writeQueue.add(ByteBuffer.wrap(response));
            onWritable();
        }

        private void onParseRequest() {
            stopReading();
            MicrohttpRequest request = requestParser.request();
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "read_request"),
                        new LogEntry("id", id),
                        new LogEntry("method", request.method()),
                        new LogEntry("uri", request.uri()));
            }
            applyConnectionPolicy(request);
            headRequest = HEAD.equalsIgnoreCase(request.method());
            chunkedStream = false;
            awaitingResponse = true;
            responseQueued = false;
            byteTokenizer.compact();
            requestParser = new RequestParser(byteTokenizer, remoteAddress);
            try {
                handler.handle(request, new ConnectionExchange());
            } catch (RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "handler_error"),
                            new LogEntry("id", id));
                }
                writeQueue.clear();
                respondAndClose(INTERNAL_SERVER_ERROR_RESPONSE);
            }
        }

        // Runs a write task on this listener's thread regardless of the calling thread
        private void enqueue(WriteTask writeTask) {
            taskQueue.add(() -> {
                if (closed.get()) {
                    return;
                }
                try {
                    writeTask.run();
                } catch (IOException e) {
                    // the socket write failed, typically because the peer hung up
                    if (logger.enabled()) {
                        logger.log(e,
                                new LogEntry("event", "write_error"),
                                new LogEntry("id", id));
                    }
                    failSafeClose();
                } catch (RuntimeException e) {
                    if (logger.enabled()) {
                        logger.log(e,
                                new LogEntry("event", "response_ready_error"),
                                new LogEntry("id", id));
                    }
                    failSafeClose();
                }
            });
            // tasks queued from the loop thread itself run at the end of the current iteration
            if (Thread.currentThread() != thread) {
                selector.wakeup();
            }
        }

        private List<Header> connectionHeaders() {
            List<Header> headers = new ArrayList<>();
            if (closeAfterResponse && !httpOneDotZero) {
                headers.add(new Header(HEADER_CONNECTION, CLOSE));
            } else if (httpOneDotZero && keepAlive && !closeAfterResponse) {
                headers.add(new Header(HEADER_CONNECTION, KEEP_ALIVE));
            }
            return headers;
        }

        private void prepareResponse(MicrohttpResponse response) throws IOException {
            if (hasHeaderToken(response.headers(), HEADER_CONNECTION, CLOSE)) {
                closeAfterResponse = true;
            }
            boolean statusAllowsBody = response.status() >= 200 && response.status() != 204 && response.status() != 304;
            List<Header> headers = response.hasHeader(HEADER_CONNECTION) ? new ArrayList<>() : connectionHeaders();
            if (statusAllowsBody && !response.hasHeader(HEADER_CONTENT_LENGTH)) {
                headers.add(new Header(HEADER_CONTENT_LENGTH, Integer.toString(response.body().length)));
            }
            String version = httpOneDotZero ? HTTP_1_0 : HTTP_1_1;
            byte[] bytes = headRequest || !statusAllowsBody ? response.serializeHead(version, headers) : response.serialize(version, headers);
            writeQueue.add(ByteBuffer.wrap(bytes));
            responseQueued = true;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "response_ready"),
                        new LogEntry("id", id),
                        new LogEntry("num_bytes", Integer.toString(bytes.length)));
            }
            doOnWritable();
        }

        private void prepareStreamHead(MicrohttpResponse head) throws IOException {
            // HTTP/1.0 has no chunked encoding, so the body is delimited by closing the connection
            if (httpOneDotZero) {
                closeAfterResponse = true;
            } else {
                chunkedStream = !headRequest;
            }
            List<Header> headers = connectionHeaders();
            if (chunkedStream && !head.hasHeader(HEADER_TRANSFER_ENCODING)) {
                headers.add(new Header(HEADER_TRANSFER_ENCODING, CHUNKED));
            }
            String version = httpOneDotZero ? HTTP_1_0 : HTTP_1_1;
            writeQueue.add(ByteBuffer.wrap(head.serializeHead(version, headers)));
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "stream_start"),
                        new LogEntry("id", id));
            }
            doOnWritable();
        }

        private void prepareChunk(byte[] chunk) throws IOException {
            // A zero-length chunk would be read as the end of the body
            if (headRequest || chunk.length == 0) {
                return;
            }
            if (chunkedStream) {
                ByteMerger merger = new ByteMerger();
                merger.add(Integer.toHexString(chunk.length).getBytes(StandardCharsets.US_ASCII));
                merger.add(MicrohttpResponse.CRLF);
                merger.add(chunk);
                merger.add(MicrohttpResponse.CRLF);
                writeQueue.add(ByteBuffer.wrap(merger.merge()));
            } else {
                writeQueue.add(ByteBuffer.wrap(chunk));
            }
            doOnWritable();
        }

        private void prepareStreamEnd() throws IOException {
            if (chunkedStream) {
                writeQueue.add(ByteBuffer.wrap(LAST_CHUNK));
            }
            responseQueued = true;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "stream_end"),
                        new LogEntry("id", id));
            }
            doOnWritable();
        }

        private void prepareStreamAbort() throws IOException {
            // No last chunk, so the client sees a truncated body
            closeAfterResponse = true;
            responseQueued = true;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "stream_abort"),
                        new LogEntry("id", id));
            }
            doOnWritable();
        }

        private void onWritable() {
            try {
                doOnWritable();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "write_error"),
                            new LogEntry("id", id));
                }
                failSafeClose();
            }
        }

        private void doOnWritable() throws IOException {
            if (closed.get()) {
                return;
            }
            while (!writeQueue.isEmpty()) {
                ByteBuffer next = writeQueue.peek();
                int numBytes = socketChannel.write(next);
                if (next.hasRemaining()) { // socket buffer full, wait for it to drain
                    if ((selectionKey.interestOps() & SelectionKey.OP_WRITE) == 0) {
                        selectionKey.interestOps(SelectionKey.OP_WRITE);
                    }
                    if (logger.enabled()) {
                        logger.log(
                                new LogEntry("event", "write"),
                                new LogEntry("id", id),
                                new LogEntry("num_bytes", Integer.toString(numBytes)));
                    }
                    return;
                }
                writeQueue.poll();
            }
            if (!awaitingResponse) {
                return;
            }
            if (!responseQueued) { // streaming, more chunks to come
                if (selectionKey.interestOps() != 0) {
                    selectionKey.interestOps(0);
                }
                return;
            }
            onResponseWritten();
        }

        private void onResponseWritten() throws IOException {
            awaitingResponse = false;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "write_response"),
                        new LogEntry("id", id));
            }
            if (closeAfterResponse) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "close_after_response"),
                            new LogEntry("id", id));
                }
                failSafeClose();
            } else if (requestParser.parse()) { // next request already buffered
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "pipeline_request"),
                            new LogEntry("id", id),
                            new LogEntry("request_bytes", Integer.toString(byteTokenizer.remaining())));
                }
                onParseRequest();
            } else {
                requestTimeoutTask = timeoutQueue.schedule(this::onRequestTimeout, options.requestTimeout());
                selectionKey.interestOps(SelectionKey.OP_READ);
            }
        }

        private void failSafeClose() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (requestTimeoutTask != null) {
                requestTimeoutTask.cancel();
                requestTimeoutTask = null;
            }
            writeQueue.clear();
            selectionKey.cancel();
            CloseUtils.closeQuietly(socketChannel);
            connectionCount.decrementAndGet();
        }

        private void applyConnectionPolicy(MicrohttpRequest request) {
            closeAfterResponse = false;
            httpOneDotZero = request.version().equalsIgnoreCase(HTTP_1_0);

            boolean hasClose = hasHeaderToken(request.headers(), HEADER_CONNECTION, CLOSE);
            boolean hasKeepAlive = hasHeaderToken(request.headers(), HEADER_CONNECTION, KEEP_ALIVE);

            if (hasClose) {
                keepAlive = false;
                closeAfterResponse = true;
            } else if (httpOneDotZero) {
                keepAlive = hasKeepAlive;
                closeAfterResponse = !keepAlive;
            } else {
                keepAlive = true;
            }
        }

        private boolean hasHeaderToken(List<Header> headers, String headerName, String token) {
            for (Header header : headers) {
                if (!header.name().equalsIgnoreCase(headerName) || header.value() == null) {
                    continue;
                }
                for (String part : header.value().split(",")) {
                    if (token.equalsIgnoreCase(part.trim())) {
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Write side of the request most recently parsed on this connection.
         */
        private class ConnectionExchange implements Exchange {
            private final AtomicBoolean started = new AtomicBoolean();
            private final AtomicBoolean streaming = new AtomicBoolean();
            private final AtomicBoolean finished = new AtomicBoolean();

            @Override
            public void respond(MicrohttpResponse response) {
                if (!started.compareAndSet(false, true)) {
                    throw new IllegalStateException("A response was already started for this request");
                }
                finished.set(true);
                enqueue(() -> prepareResponse(response));
            }

            @Override
            public void beginStream(MicrohttpResponse head) {
                if (!started.compareAndSet(false, true)) {
                    throw new IllegalStateException("A response was already started for this request");
                }
                streaming.set(true);
                enqueue(() -> prepareStreamHead(head));
            }

            @Override
            public boolean writeChunk(byte[] chunk) {
                if (!streaming.get() || finished.get()) {
                    throw new IllegalStateException("No open stream for this request");
                }
                if (closed.get()) {
                    return false;
                }
                enqueue(() -> prepareChunk(chunk));
                return true;
            }

            @Override
            public void endStream() {
                if (!streaming.get()) {
                    throw new IllegalStateException("No stream was started for this request");
                }
                if (finished.compareAndSet(false, true)) {
                    enqueue(Connection.this::prepareStreamEnd);
                }
            }

            @Override
            public void abortStream() {
                if (!streaming.get()) {
                    throw new IllegalStateException("No stream was started for this request");
                }
                if (finished.compareAndSet(false, true)) {
                    enqueue(Connection.this::prepareStreamAbort);
                }
            }

            @Override
            public boolean isOpen() {
                return !closed.get();
            }
        }
    }

    int numConnections() {
        return connectionCount.get();
    }

    void start() {
        thread.start();
    }

    void wakeup() {
        selector.wakeup();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    private void run() {
        try {
            doStart();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "listener_loop_terminate"));
            }
            stop.set(true); // stop the world on critical error
        } finally {
            for (SelectionKey selKey : selector.keys()) {
                if (selKey.attachment() instanceof Connection connection) {
                    connection.failSafeClose();
                }
            }
            CloseUtils.closeQuietly(selector);
        }
    }

    private void doStart() throws IOException {
        while (!stop.get()) {
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                it.remove();
                if (!selKey.isValid()) {
                    continue;
                }
                if (selKey.isAcceptable()) {
                    onAcceptable();
                } else if (selKey.isReadable()) {
                    ((Connection) selKey.attachment()).onReadable();
                } else if (selKey.isWritable()) {
                    ((Connection) selKey.attachment()).onWritable();
                }
            }
            timeoutQueue.expired().forEach(Runnable::run);
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                task.run();
            }
        }
    }

    private void onAcceptable() {
        SocketChannel socketChannel;
        try {
            socketChannel = serverSocketChannel.accept();
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "accept_error"));
            }
            return;
        }
        // Another listener won the race for this connection
        if (socketChannel == null) {
            return;
        }
        try {
            register(socketChannel);
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "register_error"));
            }
            CloseUtils.closeQuietly(socketChannel);
        }
    }

    private void register(SocketChannel socketChannel) throws IOException {
        socketChannel.configureBlocking(false);
        SelectionKey selectionKey = socketChannel.register(selector, SelectionKey.OP_READ);
        SocketAddress socketAddress = socketChannel.getRemoteAddress();
        InetSocketAddress remoteAddress = socketAddress instanceof InetSocketAddress inetSocketAddress
                ? inetSocketAddress
                : null;
        Connection connection = new Connection(socketChannel, selectionKey, remoteAddress);
        connectionCount.incrementAndGet();
        selectionKey.attach(connection);
        if (logger.enabled()) {
            logger.log(
                    new LogEntry("event", "accept"),
                    new LogEntry("remote_address", String.valueOf(socketAddress)),
                    new LogEntry("id", connection.id));
        }
    }
}
