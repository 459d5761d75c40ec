package com.tony.matchForecast.repository;

import com.tony.matchForecast.model.PredictionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {

    List<PredictionRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    // Prédictions dont le match a été joué depuis (pour mesurer la précision)
    @Query("SELECT p FROM PredictionRecord p WHERE p.match.homeScore IS NOT NULL AND p.match.awayScore IS NOT NULL")
    List<PredictionRecord> findEvaluable();
}
