package com.tony.matchForecast.model.feature;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Facteurs externes. Aucune source réelle branchée : valeurs neutres marquées {@code placeholder}.
 */
@Value
@Builder(toBuilder = true)
public class ExternalFactors {

    // 1 (tempête) - 10 (idéal)
    @Builder.Default double weatherCondition = 7.0;
    @Builder.Default double temperature = 20.0;
    @Builder.Default double expectedAttendance = 50_000;
    @Builder.Default double attendancePercentage = 85.0;

    @Builder.Default double refereeHomeFavorBias = 0.0;
    @Builder.Default double refereeAvgCards = 3.5;
    @Builder.Default double refereeAvgPenalties = 0.8;

    // 1-10
    @Builder.Default double homeMotivation = 7.0;
    @Builder.Default double awayMotivation = 7.0;
    // % de joueurs clés absents
    @Builder.Default double homeKeyPlayersMissing = 0.0;
    @Builder.Default double awayKeyPlayersMissing = 0.0;

    @Builder.Default boolean placeholder = true;
    boolean lookupFailed;

    public static ExternalFactors neutral() {
        return ExternalFactors.builder().build();
    }

    public static ExternalFactors unavailable() {
        return ExternalFactors.builder().lookupFailed(true).build();
    }

    public Map<String, Double> numericFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        fields.put("weather_condition", weatherCondition);
        fields.put("temperature", temperature);
        fields.put("expected_attendance", expectedAttendance);
        fields.put("attendance_percentage", attendancePercentage);
        fields.put("referee_home_favor_bias", refereeHomeFavorBias);
        fields.put("referee_avg_cards", refereeAvgCards);
        fields.put("referee_avg_penalties", refereeAvgPenalties);
        fields.put("home_motivation", homeMotivation);
        fields.put("away_motivation", awayMotivation);
        fields.put("home_key_players_missing", homeKeyPlayersMissing);
        fields.put("away_key_players_missing", awayKeyPlayersMissing);
        return fields;
    }
}
