package com.tony.matchForecast.config;

import com.tony.matchForecast.exception.PredictionValidationException;
import com.tony.matchForecast.exception.TeamNotFoundException;
import com.tony.matchForecast.exception.TransientLookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Traduit les erreurs du moteur en ProblemDetail (application/problem+json).
 */
@RestControllerAdvice
@Slf4j
public class ProblemHandler {

    private static final long RETRY_AFTER_SECONDS = 5;

    @ExceptionHandler(TeamNotFoundException.class)
    public ProblemDetail notFound(TeamNotFoundException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        pd.setTitle("Team Not Found");
        pd.setProperty("teamId", ex.getTeamId());
        return pd;
    }

    @ExceptionHandler(PredictionValidationException.class)
    public ProblemDetail invalid(PredictionValidationException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setTitle("Invalid Prediction Request");
        return pd;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail invalidBody(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " : " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(TransientLookupException.class)
    public ResponseEntity<ProblemDetail> unavailable(TransientLookupException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
        pd.setTitle("Data Source Unavailable");
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(RETRY_AFTER_SECONDS));
        return new ResponseEntity<>(pd, headers, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail unexpected(Exception ex) {
        log.error("❌ Erreur inattendue : {}", ex.getMessage(), ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
