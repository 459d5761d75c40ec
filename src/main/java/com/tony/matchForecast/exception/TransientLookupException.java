package com.tony.matchForecast.exception;

/**
 * Collaborateur indisponible ou trop lent. L'appelant peut réessayer.
 */
public class TransientLookupException extends ForecastException {

    public TransientLookupException(String message) {
        super(message);
    }

    public TransientLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
