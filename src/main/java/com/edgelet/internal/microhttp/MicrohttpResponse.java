package com.edgelet.internal.microhttp;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Status line, headers and (possibly empty) body of a response. For streamed responses only the
 * status line and headers are used and the body travels separately as chunks.
 */
public record MicrohttpResponse(
        int status,
        String reason,
        List<Header> headers,
        byte[] body) {

    static final byte[] COLON_SPACE = ": ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);
    static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    public boolean hasHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    byte[] serialize(String version, List<Header> headers) {
        ByteMerger merger = serializeHeadTo(new ByteMerger(), version, headers);
        merger.add(body);
        return merger.merge();
    }

    byte[] serializeHead(String version, List<Header> headers) {
        return serializeHeadTo(new ByteMerger(), version, headers).merge();
    }

    private ByteMerger serializeHeadTo(ByteMerger merger, String version, List<Header> headers) {
        merger.add(version.getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(Integer.toString(status).getBytes(StandardCharsets.US_ASCII));
        merger.add(SPACE);
        merger.add(reason.getBytes(StandardCharsets.ISO_8859_1));
        merger.add(CRLF);
        appendHeaders(merger, headers);
        appendHeaders(merger, this.headers);
        merger.add(CRLF);
        return merger;
    }

    private static void appendHeaders(ByteMerger merger, List<Header> headers) {
        for (Header header : headers) {
            merger.add(header.name().getBytes(StandardCharsets.US_ASCII));
            merger.add(COLON_SPACE);
            merger.add(header.value().getBytes(StandardCharsets.ISO_8859_1));
            merger.add(CRLF);
        }
    }

}
