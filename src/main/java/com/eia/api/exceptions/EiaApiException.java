package com.eia.api.exceptions;

/**
 * Root of all errors raised while planning, fetching or assembling EIA data.
 */
public class EiaApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EiaApiException(String message) {
        super(message);
    }

    public EiaApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
