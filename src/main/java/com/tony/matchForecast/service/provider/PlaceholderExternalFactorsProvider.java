package com.tony.matchForecast.service.provider;

import com.tony.matchForecast.model.MatchContext;
import com.tony.matchForecast.model.Team;
import com.tony.matchForecast.model.feature.ExternalFactors;
import com.tony.matchForecast.repository.TeamRepository;
import com.tony.matchForecast.service.WeatherService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Valeurs neutres (arbitre, affluence, motivation, absences) : aucune source réelle n'est branchée.
 * Seule la météo est réelle, quand une clé API est configurée et que le stade est géolocalisé.
 */
@Component
@RequiredArgsConstructor
public class PlaceholderExternalFactorsProvider implements ExternalFactorsProvider {

    private final WeatherService weatherService;
    private final TeamRepository teamRepository;

    @Override
    public ExternalFactors getExternalFactors(MatchContext context) {
        ExternalFactors neutral = ExternalFactors.neutral();
        if (!weatherService.isEnabled()) return neutral;

        return teamRepository.findById(context.homeTeamId())
                .flatMap((Team home) -> weatherService.getMatchWeather(home.getLatitude(), home.getLongitude()))
                .map(weather -> neutral.toBuilder()
                        .weatherCondition(weather.playingScore())
                        .temperature(weather.temperature())
                        .build())
                .orElse(neutral);
    }
}
