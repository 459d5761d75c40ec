package com.tony.matchForecast.service;

import com.tony.matchForecast.config.ForecastProperties;
import com.tony.matchForecast.exception.ForecastException;
import com.tony.matchForecast.exception.PredictionValidationException;
import com.tony.matchForecast.exception.TeamNotFoundException;
import com.tony.matchForecast.exception.TransientLookupException;
import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.TeamSnapshot;
import com.tony.matchForecast.model.dto.HistoricalContext;
import com.tony.matchForecast.model.dto.PredictionRequest;
import com.tony.matchForecast.model.dto.PredictionResponse;
import com.tony.matchForecast.model.feature.FeatureVector;
import com.tony.matchForecast.model.feature.HeadToHeadFeatures;
import com.tony.matchForecast.model.feature.TeamFeatures;
import com.tony.matchForecast.service.provider.PredictionSink;
import com.tony.matchForecast.service.provider.TeamDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Point d'entrée d'une prédiction unitaire : validation, résolution des équipes, pipeline, archivage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchPredictionService {

    private final TeamDataProvider teamDataProvider;
    private final PredictionEngineService predictionEngine;
    private final PredictionSink predictionSink;
    private final ForecastProperties properties;
    private final Clock clock;

    public PredictionResponse predict(PredictionRequest request) {
        long start = System.nanoTime();

        // 1. Validation AVANT toute lecture
        if (request == null || request.getHomeTeamId() == null || request.getAwayTeamId() == null) {
            throw new PredictionValidationException("Les deux équipes sont requises");
        }
        if (request.getHomeTeamId().equals(request.getAwayTeamId())) {
            throw new PredictionValidationException(
                    "Une équipe ne peut pas jouer contre elle-même (ID " + request.getHomeTeamId() + ")");
        }

        // 2. Récupération des équipes (Fast Fail)
        TeamSnapshot home = resolveTeam(request.getHomeTeamId());
        TeamSnapshot away = resolveTeam(request.getAwayTeamId());

        LocalDateTime matchDate = request.getMatchDate() != null ? request.getMatchDate() : LocalDateTime.now(clock);
        String league = request.getLeague() != null ? request.getLeague() : home.league();
        MatchContext context = new MatchContext(home.id(), away.id(), league, matchDate, request.getVenue());

        log.info("⚽ Prédiction {} vs {} ({})", home.name(), away.name(), matchDate);

        // 3. Calcul
        PredictionEngineService.Forecast forecast = predictionEngine.forecast(context, home, away);
        EnsembleResult result = forecast.result();
        boolean highConfidence = result.getConfidence() > properties.getHighConfidenceThreshold();

        // 4. Archivage (un échec ne bloque jamais la réponse)
        try {
            predictionSink.store(context, result, highConfidence);
        } catch (RuntimeException e) {
            log.warn("⚠️ Archivage impossible pour {} vs {} : {}", home.name(), away.name(), e.getMessage());
        }

        return PredictionResponse.builder()
                .matchInfo(PredictionResponse.MatchInfo.builder()
                        .homeTeam(toTeamInfo(home))
                        .awayTeam(toTeamInfo(away))
                        .league(league)
                        .matchDate(matchDate)
                        .build())
                .prediction(result)
                .highConfidence(highConfidence)
                .keyFactors(result.getKeyFactors())
                .historicalContext(toHistoricalContext(forecast.features()))
                .timestamp(LocalDateTime.now(clock))
                .processingTimeMs((System.nanoTime() - start) / 1_000_000)
                .build();
    }

    /**
     * Une panne ou un délai dépassé côté base est une erreur transitoire, pas une erreur serveur.
     */
    private TeamSnapshot resolveTeam(Long teamId) {
        Optional<TeamSnapshot> team;
        try {
            team = teamDataProvider.findTeam(teamId);
        } catch (ForecastException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("⚠️ Lecture de l'équipe {} impossible : {}", teamId, e.getMessage());
            throw new TransientLookupException("Données de l'équipe " + teamId + " indisponibles : " + e.getMessage(), e);
        }
        return team.orElseThrow(() -> new TeamNotFoundException(teamId));
    }

    private static HistoricalContext toHistoricalContext(FeatureVector features) {
        HeadToHeadFeatures h2h = features.getHeadToHead();
        return HistoricalContext.builder()
                .headToHeadRecord(HistoricalContext.HeadToHeadRecord.builder()
                        .totalMatches((int) h2h.getMatchesPlayed())
                        .homeTeamWins((int) h2h.getHomeWins())
                        .draws((int) h2h.getDraws())
                        .awayTeamWins((int) h2h.getAwayWins())
                        .lastMeeting(h2h.getLastMeetingDate())
                        .build())
                .homeTeamForm(toFormComparison(features.getHome()))
                .awayTeamForm(toFormComparison(features.getAway()))
                .build();
    }

    private static HistoricalContext.FormComparison toFormComparison(TeamFeatures team) {
        return HistoricalContext.FormComparison.builder()
                .last5Games(team.getRecentForm())
                .points((int) team.getFormPointsLast5())
                .goalsFor((int) team.getFormGoalsForLast5())
                .goalsAgainst((int) team.getFormGoalsAgainstLast5())
                .build();
    }

    private static PredictionResponse.TeamInfo toTeamInfo(TeamSnapshot team) {
        return PredictionResponse.TeamInfo.builder()
                .id(team.id())
                .name(team.name())
                .rank(team.rank())
                .form(team.formSequence())
                .build();
    }
}
