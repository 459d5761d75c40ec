package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.EnsembleResult;
import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.MatchRecord;
import com.tony.matchForecast.model.PredictionRecord;
import com.tony.matchForecast.repository.MatchRecordRepository;
import com.tony.matchForecast.repository.PredictionRecordRepository;
import com.tony.matchForecast.repository.TeamRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaPredictionSink implements PredictionSink {

    private final MatchRecordRepository matchRepository;
    private final PredictionRecordRepository predictionRepository;
    private final TeamRepository teamRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void store(MatchContext context, EnsembleResult result, boolean highConfidence) {
        MatchRecord match = matchRepository
                .findFirstByHomeTeamIdAndAwayTeamIdAndMatchDate(context.homeTeamId(), context.awayTeamId(), context.scheduledAt())
                .orElseGet(() -> createScheduledMatch(context));

        PredictionRecord record = new PredictionRecord();
        record.setMatch(match);
        record.setPredictedOutcome(result.getPredictedOutcome());
        record.setHomeWinProbability(result.getProbabilities().homeWin());
        record.setDrawProbability(result.getProbabilities().draw());
        record.setAwayWinProbability(result.getProbabilities().awayWin());
        record.setConfidence(result.getConfidence());
        record.setHighConfidence(highConfidence);
        record.setDegraded(result.isDegraded());
        record.setReasoning(new ArrayList<>(result.getReasoning()));
        record.setCreatedAt(LocalDateTime.now(clock));

        predictionRepository.save(record);
        log.debug("💾 Prédiction archivée pour le match {}", match.getId());
    }

    private MatchRecord createScheduledMatch(MatchContext context) {
        MatchRecord match = new MatchRecord();
        match.setHomeTeam(teamRepository.findById(context.homeTeamId())
                .orElseThrow(() -> new EntityNotFoundException("Équipe domicile introuvable")));
        match.setAwayTeam(teamRepository.findById(context.awayTeamId())
                .orElseThrow(() -> new EntityNotFoundException("Équipe extérieur introuvable")));
        match.setMatchDate(context.scheduledAt());
        match.setVenue(context.venue());
        return matchRepository.save(match);
    }
}
