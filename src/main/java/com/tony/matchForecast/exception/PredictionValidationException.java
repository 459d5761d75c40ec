package com.tony.matchForecast.exception;

/**
 * Requête mal formée, équipe opposée à elle-même, feature non finie, lot trop gros...
 */
public class PredictionValidationException extends ForecastException {

    public PredictionValidationException(String message) {
        super(message);
    }
}
