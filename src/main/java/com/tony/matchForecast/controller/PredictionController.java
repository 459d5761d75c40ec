package com.tony.matchForecast.controller;

import com.tony.matchForecast.model.dto.AccuracyStats;
import com.tony.matchForecast.model.dto.PredictionHistoryEntry;
import com.tony.matchForecast.model.dto.PredictionRequest;
import com.tony.matchForecast.model.dto.PredictionResponse;
import com.tony.matchForecast.service.BatchPredictionService;
import com.tony.matchForecast.service.MatchPredictionService;
import com.tony.matchForecast.service.PredictionAccuracyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {
    private final MatchPredictionService matchPredictionService;
    private final BatchPredictionService batchPredictionService;
    private final PredictionAccuracyService accuracyService;

    @PostMapping
    public ResponseEntity<PredictionResponse> predict(@Valid @RequestBody PredictionRequest request) {
        return ResponseEntity.ok(matchPredictionService.predict(request));
    }

    @PostMapping("/batch")
    public ResponseEntity<List<PredictionResponse>> predictBatch(@RequestBody List<PredictionRequest> requests) {
        return ResponseEntity.ok(batchPredictionService.predictBatch(requests));
    }

    @GetMapping("/history")
    public ResponseEntity<List<PredictionHistoryEntry>> getHistory(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(accuracyService.getHistory(limit));
    }

    @GetMapping("/accuracy")
    public ResponseEntity<AccuracyStats> getAccuracy() {
        return ResponseEntity.ok(accuracyService.getAccuracyStats());
    }
}
