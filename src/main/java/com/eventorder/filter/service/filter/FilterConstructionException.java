package com.eventorder.filter.service.filter;

/**
 * Exception thrown when a membership filter cannot be built from its parameters.
 */
public class FilterConstructionException extends RuntimeException {

    public static final String MISSING_HASH_FUNCTION = "MISSING_HASH_FUNCTION";
    public static final String CAPACITY_OVERFLOW = "CAPACITY_OVERFLOW";

    private final String errorCode;

    public FilterConstructionException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
