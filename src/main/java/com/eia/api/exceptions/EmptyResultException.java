package com.eia.api.exceptions;

/**
 * The probe or the assembled dataset returned zero rows.
 */
public class EmptyResultException extends EiaApiException {

    private static final long serialVersionUID = 1L;

    public EmptyResultException(String message) {
        super(message);
    }
}
