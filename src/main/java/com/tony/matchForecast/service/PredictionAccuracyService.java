package com.tony.matchForecast.service;

import com.tony.matchForecast.model.MatchRecord;
import com.tony.matchForecast.model.Outcome;
import com.tony.matchForecast.model.PredictionRecord;
import com.tony.matchForecast.model.dto.AccuracyStats;
import com.tony.matchForecast.model.dto.PredictionHistoryEntry;
import com.tony.matchForecast.repository.PredictionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Historique des prédictions archivées et mesure de leur précision.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PredictionAccuracyService {

    private final PredictionRecordRepository repository;

    public List<PredictionHistoryEntry> getHistory(int limit) {
        if (limit <= 0) return List.of();
        return repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit)).stream()
                .map(this::toEntry)
                .toList();
    }

    public AccuracyStats getAccuracyStats() {
        long total = repository.count();
        List<PredictionRecord> evaluable = repository.findEvaluable();

        long correct = 0;
        double confCorrect = 0.0;
        double confIncorrect = 0.0;
        Map<Outcome, long[]> perOutcome = new EnumMap<>(Outcome.class); // [prédites, correctes]
        for (Outcome o : Outcome.values()) perOutcome.put(o, new long[2]);

        for (PredictionRecord p : evaluable) {
            boolean isCorrect = p.getPredictedOutcome() == actualOutcome(p.getMatch());
            double confidence = p.getConfidence() != null ? p.getConfidence() : 0.0;

            long[] counts = perOutcome.get(p.getPredictedOutcome());
            counts[0]++;
            if (isCorrect) {
                correct++;
                counts[1]++;
                confCorrect += confidence;
            } else {
                confIncorrect += confidence;
            }
        }

        long incorrect = evaluable.size() - correct;
        return new AccuracyStats(
                total,
                evaluable.size(),
                correct,
                ratio(correct, evaluable.size()),
                correct == 0 ? 0.0 : confCorrect / correct,
                incorrect == 0 ? 0.0 : confIncorrect / incorrect,
                ratio(perOutcome.get(Outcome.HOME_WIN)[1], perOutcome.get(Outcome.HOME_WIN)[0]),
                ratio(perOutcome.get(Outcome.DRAW)[1], perOutcome.get(Outcome.DRAW)[0]),
                ratio(perOutcome.get(Outcome.AWAY_WIN)[1], perOutcome.get(Outcome.AWAY_WIN)[0]));
    }

    private PredictionHistoryEntry toEntry(PredictionRecord p) {
        MatchRecord match = p.getMatch();
        Outcome actual = match.isFinished() ? actualOutcome(match) : null;

        return PredictionHistoryEntry.builder()
                .predictionId(p.getId())
                .homeTeam(match.getHomeTeam().getName())
                .awayTeam(match.getAwayTeam().getName())
                .matchDate(match.getMatchDate())
                .predictedOutcome(p.getPredictedOutcome())
                .homeWinProbability(orZero(p.getHomeWinProbability()))
                .drawProbability(orZero(p.getDrawProbability()))
                .awayWinProbability(orZero(p.getAwayWinProbability()))
                .confidence(orZero(p.getConfidence()))
                .actualOutcome(actual)
                .correct(actual == null ? null : actual == p.getPredictedOutcome())
                .createdAt(p.getCreatedAt())
                .build();
    }

    private static Outcome actualOutcome(MatchRecord match) {
        return Outcome.fromScore(match.getHomeScore(), match.getAwayScore());
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
