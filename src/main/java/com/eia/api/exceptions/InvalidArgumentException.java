package com.eia.api.exceptions;

/**
 * Malformed facets, inverted ranges or wrong argument types. Always raised before
 * any request is sent.
 */
public class InvalidArgumentException extends EiaApiException {

    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
