package com.edgelet.internal.microhttp;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Incremental HTTP/1.x request parser. Each call to {@link #parse()} consumes as many tokens as
 * the tokenizer currently holds and reports whether a whole request has been read.
 * A parser instance reads exactly one request.
 */
class RequestParser {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);

    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    private static final String CHUNKED = "chunked";
    private static final String VERSION_PREFIX = "HTTP/1.";
    private static final byte[] EMPTY_BODY = new byte[]{};

    private static final int RADIX_HEX = 16;

    enum State {
        METHOD(p -> p.tokenizer.next(SPACE), RequestParser::parseMethod),
        URI(p -> p.tokenizer.next(SPACE), RequestParser::parseUri),
        VERSION(p -> p.tokenizer.next(CRLF), RequestParser::parseVersion),
        HEADER(p -> p.tokenizer.next(CRLF), RequestParser::parseHeader),
        BODY(p -> p.tokenizer.next(p.contentLength), RequestParser::parseBody),
        CHUNK_SIZE(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkSize),
        CHUNK_DATA(p -> p.tokenizer.next(p.chunkSize), RequestParser::parseChunkData),
        CHUNK_DATA_END(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkDataEnd),
        CHUNK_TRAILER(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkTrailer),
        DONE(null, null);

        final Function<RequestParser, byte[]> tokenSupplier;
        final BiConsumer<RequestParser, byte[]> tokenConsumer;

        State(Function<RequestParser, byte[]> tokenSupplier, BiConsumer<RequestParser, byte[]> tokenConsumer) {
            this.tokenSupplier = tokenSupplier;
            this.tokenConsumer = tokenConsumer;
        }
    }

    private final ByteTokenizer tokenizer;
    private final InetSocketAddress remoteAddress;

    private State state = State.METHOD;
    private int contentLength;
    private int chunkSize;
    private final ByteMerger chunks = new ByteMerger();

    private String method;
    private String uri;
    private String version;
    private final List<Header> headers = new ArrayList<>();
    private byte[] body;

    RequestParser(ByteTokenizer tokenizer, InetSocketAddress remoteAddress) {
        this.tokenizer = tokenizer;
        this.remoteAddress = remoteAddress;
    }

    /**
     * @return {@code true} once a complete request has been parsed
     * @throws MalformedRequestException if the input cannot be a valid request
     */
    boolean parse() {
        while (state != State.DONE) {
            byte[] token = state.tokenSupplier.apply(this);
            if (token == null) {
                return false;
            }
            state.tokenConsumer.accept(this, token);
        }
        return true;
    }

    MicrohttpRequest request() {
        return new MicrohttpRequest(method, uri, version, List.copyOf(headers), body, remoteAddress);
    }

    State state() {
        return state;
    }

    private void parseMethod(byte[] token) {
        if (token.length == 0) {
            throw new MalformedRequestException("empty method");
        }
        requireAscii(token, "method");
        method = new String(token, StandardCharsets.US_ASCII);
        state = State.URI;
    }

    private void parseUri(byte[] token) {
        if (token.length == 0) {
            throw new MalformedRequestException("empty uri");
        }
        requireAscii(token, "uri");
        uri = new String(token, StandardCharsets.US_ASCII);
        state = State.VERSION;
    }

    private void parseVersion(byte[] token) {
        requireAscii(token, "version");
        version = new String(token, StandardCharsets.US_ASCII);
        if (!version.startsWith(VERSION_PREFIX)) {
            throw new MalformedRequestException("unsupported version");
        }
        state = State.HEADER;
    }

    private void parseHeader(byte[] token) {
        if (token.length > 0) {
            headers.add(parseHeaderLine(token));
            return;
        }

        // Blank line: end of headers, decide how the body is framed
        Integer declaredLength = findContentLength();
        List<String> transferEncodings = findTransferEncodings();
        boolean hasTransferEncoding = hasHeader(HEADER_TRANSFER_ENCODING);

        if (hasTransferEncoding && transferEncodings.isEmpty()) {
            throw new MalformedRequestException("invalid transfer-encoding header value");
        }
        if (declaredLength != null && hasTransferEncoding) {
            throw new MalformedRequestException("multiple message lengths");
        }

        if (hasTransferEncoding) {
            if (transferEncodings.size() != 1 || !CHUNKED.equals(transferEncodings.get(0))) {
                throw new MalformedRequestException("unsupported transfer-encoding");
            }
            state = State.CHUNK_SIZE;
        } else if (declaredLength == null || declaredLength == 0) {
            body = EMPTY_BODY;
            state = State.DONE;
        } else {
            contentLength = declaredLength;
            state = State.BODY;
        }
    }

    private static Header parseHeaderLine(byte[] line) {
        int colonIndex = -1;
        for (int i = 0; i < line.length; i++) {
            if (line[i] == ':') {
                colonIndex = i;
                break;
            }
        }
        if (colonIndex <= 0) {
            throw new MalformedRequestException("malformed header line");
        }
        for (int i = 0; i < colonIndex; i++) {
            if ((line[i] & 0x80) != 0 || line[i] == ' ' || line[i] == '\t') {
                throw new MalformedRequestException("invalid header name");
            }
        }
        int start = colonIndex + 1;
        int end = line.length;
        while (start < end && (line[start] == ' ' || line[start] == '\t')) {
            start++;
        }
        while (end > start && (line[end - 1] == ' ' || line[end - 1] == '\t')) {
            end--;
        }
        return new Header(
                new String(line, 0, colonIndex, StandardCharsets.US_ASCII),
                new String(line, start, end - start, StandardCharsets.ISO_8859_1));
    }

    private static void requireAscii(byte[] token, String field) {
        for (byte b : token) {
            if ((b & 0x80) != 0) {
                throw new MalformedRequestException("non-ascii " + field);
            }
        }
    }

    private void parseChunkSize(byte[] token) {
        int end = token.length;
        for (int i = 0; i < token.length; i++) {
            if (token[i] == ';') { // chunk extensions are ignored
                end = i;
                break;
            }
        }
        String sizeToken = new String(token, 0, end, StandardCharsets.US_ASCII).trim();
        try {
            chunkSize = Integer.parseInt(sizeToken, RADIX_HEX);
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("invalid chunk size");
        }
        if (chunkSize < 0) {
            throw new MalformedRequestException("invalid chunk size");
        }
        state = chunkSize == 0 ? State.CHUNK_TRAILER : State.CHUNK_DATA;
    }

    private void parseChunkData(byte[] token) {
        chunks.add(token);
        state = State.CHUNK_DATA_END;
    }

    private void parseChunkDataEnd(byte[] token) {
        if (token.length != 0) {
            throw new MalformedRequestException("missing chunk terminator");
        }
        state = State.CHUNK_SIZE;
    }

    private void parseChunkTrailer(byte[] token) {
        if (token.length == 0) {
            body = chunks.merge();
            state = State.DONE;
        }
    }

    private void parseBody(byte[] token) {
        body = token;
        state = State.DONE;
    }

    private Integer findContentLength() {
        Integer result = null;
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_CONTENT_LENGTH)) {
                continue;
            }
            if (result != null) {
                throw new MalformedRequestException("multiple content-length headers");
            }
            try {
                result = Integer.parseInt(header.value().trim());
            } catch (NumberFormatException e) {
                throw new MalformedRequestException("invalid content-length header value");
            }
            if (result < 0) {
                throw new MalformedRequestException("invalid content-length header value");
            }
        }
        return result;
    }

    private boolean hasHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private List<String> findTransferEncodings() {
        List<String> transferEncodings = new ArrayList<>();
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                continue;
            }
            for (String part : header.value().split(",")) {
                int semicolon = part.indexOf(';');
                String coding = (semicolon == -1 ? part : part.substring(0, semicolon)).trim();
                if (!coding.isEmpty()) {
                    transferEncodings.add(coding.toLowerCase(Locale.ROOT));
                }
            }
        }
        return transferEncodings;
    }

}
