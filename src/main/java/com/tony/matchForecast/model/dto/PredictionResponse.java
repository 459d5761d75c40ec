package com.tony.matchForecast.model.dto;

import com.tony.matchForecast.model.EnsembleResult;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class PredictionResponse {

    private MatchInfo matchInfo;
    private EnsembleResult prediction;
    private boolean highConfidence;
    private List<String> keyFactors;
    private HistoricalContext historicalContext;
    private LocalDateTime timestamp;
    private long processingTimeMs;

    @Data
    @Builder
    public static class MatchInfo {
        private TeamInfo homeTeam;
        private TeamInfo awayTeam;
        private String league;
        private LocalDateTime matchDate;
    }

    @Data
    @Builder
    public static class TeamInfo {
        private Long id;
        private String name;
        private int rank;
        private String form;
    }
}
