package com.tony.matchForecast.exception;

/**
 * Racine des erreurs catégorisées renvoyées à l'appelant du moteur.
 */
public abstract class ForecastException extends RuntimeException {

    protected ForecastException(String message) {
        super(message);
    }

    protected ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
