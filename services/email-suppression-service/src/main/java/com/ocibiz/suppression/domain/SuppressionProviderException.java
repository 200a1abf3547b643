package com.ocibiz.suppression.domain;

/**
 * Failure reported by the suppression provider.
 *
 * <p>Carries the provider's HTTP status and service code when known; {@code statusCode} is -1
 * otherwise.
 */
public class SuppressionProviderException extends RuntimeException {

    public static final int UNKNOWN_STATUS = -1;

    private final int statusCode;
    private final String serviceCode;

    public SuppressionProviderException(
            String message, int statusCode, String serviceCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.serviceCode = serviceCode;
    }

    public SuppressionProviderException(String message, Throwable cause) {
        this(message, UNKNOWN_STATUS, null, cause);
    }

    /** Re-wraps this failure with a message that names the failed operation. */
    SuppressionProviderException withOperation(String operation) {
        return new SuppressionProviderException(
                operation + ": " + getMessage(), statusCode, serviceCode, this);
    }

    public int statusCode() {
        return statusCode;
    }

    public String serviceCode() {
        return serviceCode;
    }
}
