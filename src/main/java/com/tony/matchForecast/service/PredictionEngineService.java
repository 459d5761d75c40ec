package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.ForecastException;
import com.tony.matchForecast.exception.TransientLookupException;
import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.StrategyEstimate;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.feature.ContextFeatures;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.TeamFeatures;
import com.tony.matchForecast.service.strategy.ScoringStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;

/**
 * Pipeline complet d'une prédiction : agrégation (x2) et contexte en parallèle,
 * assemblage, stratégies en parallèle, puis ensemble.
 */
@Service
@Slf4j
public class PredictionEngineService {

    private final TeamStatsService teamStatsService;
    private final ContextFeatureService contextFeatureService;
    private final FeatureVectorAssembler assembler;
    private final List<ScoringStrategy> strategies;
    private final EnsembleService ensembleService;
    private final ForecastProperties properties;
    private final Executor executor;

    public PredictionEngineService(TeamStatsService teamStatsService,
                                   ContextFeatureService contextFeatureService,
                                   FeatureVectorAssembler assembler,
                                   List<ScoringStrategy> strategies,
                                   EnsembleService ensembleService,
                                   ForecastProperties properties,
                                   @Qualifier("forecastExecutor") Executor executor) {
        this.teamStatsService = teamStatsService;
        this.contextFeatureService = contextFeatureService;
        this.assembler = assembler;
        this.strategies = strategies;
        this.ensembleService = ensembleService;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Résultat de l'ensemble et features qui l'ont produit.
     */
    public record Forecast(FeatureVector features, EnsembleResult result) {}

    public EnsembleResult predict(MatchContext context, TeamSnapshot home, TeamSnapshot away) {
        return forecast(context, home, away).result();
    }

    public Forecast forecast(MatchContext context, TeamSnapshot home, TeamSnapshot away) {
        FeatureVector features = buildFeatures(context, home, away);
        List<StrategyEstimate> estimates = runStrategies(features);
        return new Forecast(features, ensembleService.combine(estimates, features));
    }

    public FeatureVector buildFeatures(MatchContext context, TeamSnapshot home, TeamSnapshot away) {
        int window = properties.getHistoryWindow();

        CompletableFuture<TeamFeatures> homeFuture =
                CompletableFuture.supplyAsync(() -> teamStatsService.aggregate(home, window), executor);
        CompletableFuture<TeamFeatures> awayFuture =
                CompletableFuture.supplyAsync(() -> teamStatsService.aggregate(away, window), executor);
        CompletableFuture<ContextFeatures> contextFuture =
                CompletableFuture.supplyAsync(() -> contextFeatureService.build(context, home, away), executor);

        TeamFeatures homeFeatures = await(homeFuture, "stats " + home.name());
        TeamFeatures awayFeatures = await(awayFuture, "stats " + away.name());
        ContextFeatures ctx = await(contextFuture, "contexte du match");

        return assembler.assemble(homeFeatures, awayFeatures, ctx.match(), ctx.headToHead(), ctx.external());
    }

    List<StrategyEstimate> runStrategies(FeatureVector features) {
        List<CompletableFuture<StrategyEstimate>> futures = strategies.stream()
                .map(s -> CompletableFuture.supplyAsync(() -> s.score(features), executor))
                .toList();

        return IntStream.range(0, futures.size())
                .mapToObj(i -> awaitStrategy(futures.get(i), strategies.get(i).name()))
                .toList();
    }

    // Une stratégie trop lente est neutralisée, elle ne bloque pas la prédiction
    private StrategyEstimate awaitStrategy(CompletableFuture<StrategyEstimate> future, String name) {
        try {
            return await(future, "stratégie " + name);
        } catch (TransientLookupException e) {
            log.warn("⚠️ Stratégie {} neutralisée : {}", name, e.getMessage());
            return StrategyEstimate.neutral(name);
        }
    }

    private <T> T await(CompletableFuture<T> future, String what) {
        long timeoutMs = properties.getLookupTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientLookupException("Délai dépassé (" + timeoutMs + " ms) : " + what, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientLookupException("Calcul interrompu : " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ForecastException) throw (ForecastException) cause;
            throw new TransientLookupException("Source de données indisponible (" + what + ") : " + cause.getMessage(), cause);
        }
    }
}
