package com.tony.matchForecast.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.matchForecast.exception.TransientLookupException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class WeatherService {

    private static final String URL =
            "https://api.openweathermap.org/data/2.5/weather?lat={lat}&lon={lon}&units=metric&appid={key}";

    private final RestTemplate weatherRestTemplate;
    private final ObjectMapper objectMapper;

    @Value("${weather.api.key:}")
    private String apiKey;

    private boolean isEnabled;

    public record WeatherCondition(double temperature, double windSpeedKmh, boolean isRaining, String description) {

        /**
         * Note de conditions de jeu, 1 (tempête) à 10 (idéal).
         */
        public double playingScore() {
            double score = 10.0;
            if (isRaining) score -= 4.0;
            if (windSpeedKmh > 40.0) score -= 2.0;
            if (temperature < 0.0 || temperature > 32.0) score -= 2.0;
            return Math.max(1.0, Math.min(10.0, score));
        }
    }

    @PostConstruct
    public void init() {
        this.isEnabled = apiKey != null && !apiKey.trim().isEmpty();
        if (!isEnabled) {
            log.info("☁️ WeatherService désactivé (pas de clé API trouvée). La météo sera ignorée.");
        } else {
            log.info("☀️ WeatherService activé.");
        }
    }

    public boolean isEnabled() {
        return isEnabled;
    }

    /**
     * Météo actuelle sur le stade. Vide si le service est désactivé ou les coordonnées manquantes.
     *
     * @throws TransientLookupException si l'API ne répond pas ou renvoie un contenu illisible
     */
    public Optional<WeatherCondition> getMatchWeather(Double lat, Double lon) {
        if (!isEnabled || lat == null || lon == null) {
            return Optional.empty();
        }

        try {
            String body = weatherRestTemplate.getForObject(URL, String.class, lat, lon, apiKey);
            if (body == null) return Optional.empty();

            JsonNode root = objectMapper.readTree(body);
            double temp = root.path("main").path("temp").asDouble(20.0);
            double windKmh = root.path("wind").path("speed").asDouble(0.0) * 3.6;
            String main = root.path("weather").path(0).path("main").asText("Clear");
            boolean isRaining = main.contains("Rain") || main.contains("Drizzle") || main.contains("Thunderstorm");

            return Optional.of(new WeatherCondition(temp, windKmh, isRaining, main));
        } catch (RestClientException | IOException e) {
            throw new TransientLookupException("API météo indisponible : " + e.getMessage(), e);
        }
    }
}
