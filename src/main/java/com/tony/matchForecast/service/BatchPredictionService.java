package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.PredictionValidationException;
import com.tony.matchForecast.exception.TransientLookupException;
import com.tony.matchForecast.model.dto.PredictionRequest;
import com.tony.matchForecast.model.dto.PredictionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Prédictions en lot : vagues de taille fixe, exécutées en parallèle, avec une pause entre deux vagues.
 */
@Service
@Slf4j
public class BatchPredictionService {

    private final MatchPredictionService matchPredictionService;
    private final ForecastProperties properties;
    private final Executor executor;

    public BatchPredictionService(MatchPredictionService matchPredictionService,
                                  ForecastProperties properties,
                                  @Qualifier("forecastBatchExecutor") Executor batchExecutor) {
        this.matchPredictionService = matchPredictionService;
        this.properties = properties;
        this.executor = batchExecutor;
    }

    /**
     * Résultats dans l'ordre des requêtes. La première requête en échec (dans l'ordre) fait échouer le lot.
     */
    public List<PredictionResponse> predictBatch(List<PredictionRequest> requests) {
        if (requests == null || requests.isEmpty()) return List.of();

        ForecastProperties.Batch batch = properties.getBatch();
        if (requests.size() > batch.getMaxSize()) {
            throw new PredictionValidationException(
                    "Lot trop volumineux : " + requests.size() + " requêtes (max " + batch.getMaxSize() + ")");
        }

        List<List<PredictionRequest>> waves = new ArrayList<>();
        for (int i = 0; i < requests.size(); i += batch.getChunkSize()) {
            waves.add(requests.subList(i, Math.min(i + batch.getChunkSize(), requests.size())));
        }
        log.info("📦 Lot de {} prédictions ({} vagues)", requests.size(), waves.size());

        List<PredictionResponse> results = new ArrayList<>(requests.size());
        for (int w = 0; w < waves.size(); w++) {
            if (w > 0) pause();

            List<CompletableFuture<PredictionResponse>> futures = waves.get(w).stream()
                    .map(r -> CompletableFuture.supplyAsync(() -> matchPredictionService.predict(r), executor))
                    .toList();

            for (CompletableFuture<PredictionResponse> future : futures) {
                results.add(join(future));
            }
        }
        return results;
    }

    private PredictionResponse join(CompletableFuture<PredictionResponse> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw e;
        }
    }

    private void pause() {
        try {
            Thread.sleep(properties.getBatch().getPause().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientLookupException("Lot interrompu", e);
        }
    }
}
