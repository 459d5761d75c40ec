package com.tony.matchForecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatchForecastApplication {

	public static void main(String[] args) {
		SpringApplication.run(MatchForecastApplication.class, args);
	}

}
