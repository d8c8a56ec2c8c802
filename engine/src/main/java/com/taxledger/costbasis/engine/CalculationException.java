package com.taxledger.costbasis.engine;

import lombok.Getter;

/**
 * Aborts a calculation run. Continuing after any of these conditions would silently produce wrong tax figures.
 */
@Getter
public class CalculationException extends RuntimeException {

    public static final String INVALID_TAX_YEAR = "INVALID_TAX_YEAR";
    public static final String UNKNOWN_ASSET = "UNKNOWN_ASSET";
    public static final String SEED_FAILED = "SEED_FAILED";
    public static final String INSUFFICIENT_LOTS = "INSUFFICIENT_LOTS";
    public static final String MISSING_OPTION_ADJUSTMENT = "MISSING_OPTION_ADJUSTMENT";
    public static final String INVALID_OPTION_LINK = "INVALID_OPTION_LINK";
    public static final String INVALID_EVENT = "INVALID_EVENT";

    /** One of the constants above. */
    private final String errorCode;

    public CalculationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CalculationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
