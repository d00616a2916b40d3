package com.edgelet.internal.microhttp;

/**
 * Thrown by {@link RequestParser} when the bytes on the wire are not a valid HTTP/1.x request.
 */
class MalformedRequestException extends RuntimeException {

    MalformedRequestException(String message) {
        super(message);
    }

}
