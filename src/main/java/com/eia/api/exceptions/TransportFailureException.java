package com.eia.api.exceptions;

/**
 * Non-2xx response or connection level failure for a single request. Fails the
 * whole query.
 */
public class TransportFailureException extends EiaApiException {

    private static final long serialVersionUID = 1L;

    /** Status code used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String url;

    public TransportFailureException(String message, int statusCode, String url) {
        super(message);
        this.statusCode = statusCode;
        this.url = url;
    }

    public TransportFailureException(String message, int statusCode, String url, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Request URL without the credential.
     */
    public String getUrl() {
        return url;
    }

    /**
     * I/O failures, throttling (429) and server errors (5xx) may succeed on a later attempt.
     */
    public boolean isRetryable() {
        return statusCode == NO_STATUS || statusCode == 429 || statusCode >= 500;
    }
}
