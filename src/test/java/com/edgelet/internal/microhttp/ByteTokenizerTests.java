package com.edgelet.internal.microhttp;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

public class ByteTokenizerTests {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    @Test
    public void delimiterSplitAcrossReads() {
        ByteTokenizer tokenizer = new ByteTokenizer();

        tokenizer.add(bytes("GET / HTTP/1.1\r"));
        Assertions.assertNull(tokenizer.next(CRLF));

        tokenizer.add(bytes("\nHost: x\r\n"));
        Assertions.assertEquals("GET / HTTP/1.1", string(tokenizer.next(CRLF)));
        Assertions.assertEquals("Host: x", string(tokenizer.next(CRLF)));
        Assertions.assertEquals(0, tokenizer.remaining());
    }

    @Test
    public void fixedLengthTokensWaitForData() {
        ByteTokenizer tokenizer = new ByteTokenizer();

        tokenizer.add(bytes("abc"));
        Assertions.assertNull(tokenizer.next(4));
        Assertions.assertEquals(3, tokenizer.remaining());

        tokenizer.add(bytes("de"));
        Assertions.assertEquals("abcd", string(tokenizer.next(4)));
        Assertions.assertEquals(1, tokenizer.remaining());
    }

    @Test
    public void compactKeepsUnconsumedBytes() {
        ByteTokenizer tokenizer = new ByteTokenizer();

        tokenizer.add(bytes("one\r\ntwo"));
        Assertions.assertEquals("one", string(tokenizer.next(CRLF)));
        Assertions.assertNull(tokenizer.next(CRLF));

        tokenizer.compact();

        Assertions.assertEquals(3, tokenizer.size());

        tokenizer.add(bytes("\r\n"));
        Assertions.assertEquals("two", string(tokenizer.next(CRLF)));
    }

    @Test
    public void growsPastInitialCapacity() {
        ByteTokenizer tokenizer = new ByteTokenizer();
        String large = "x".repeat(5_000);

        tokenizer.add(bytes(large));
        tokenizer.add(CRLF);

        Assertions.assertEquals(large, string(tokenizer.next(CRLF)));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.US_ASCII);
    }

    private static String string(byte[] value) {
        return new String(value, StandardCharsets.US_ASCII);
    }

}
