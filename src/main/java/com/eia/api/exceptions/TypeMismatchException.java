package com.eia.api.exceptions;

/**
 * A value or period that cannot be parsed into its typed column. Never coerced to null.
 */
public class TypeMismatchException extends EiaApiException {

    private static final long serialVersionUID = 1L;

    private final String column;
    private final Object rawValue;

    public TypeMismatchException(String message, String column, Object rawValue) {
        super(message);
        this.column = column;
        this.rawValue = rawValue;
    }

    public TypeMismatchException(String message, String column, Object rawValue, Throwable cause) {
        super(message, cause);
        this.column = column;
        this.rawValue = rawValue;
    }

    public String getColumn() {
        return column;
    }

    public Object getRawValue() {
        return rawValue;
    }
}
