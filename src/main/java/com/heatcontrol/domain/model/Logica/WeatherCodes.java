package com.heatcontrol.domain.model.Logica;

import java.util.Map;

// Tabla de códigos WMO que devuelve Open-Meteo en current.weather_code
public final class WeatherCodes {

    private static final Map<Integer, String> DESCRIPTIONS = Map.ofEntries(
            Map.entry(0, "Clear Sky"),
            Map.entry(1, "Mainly Clear"),
            Map.entry(2, "Partly Cloudy"),
            Map.entry(3, "Overcast"),
            Map.entry(45, "Foggy"),
            Map.entry(48, "Foggy"),
            Map.entry(51, "Light Drizzle"),
            Map.entry(53, "Moderate Drizzle"),
            Map.entry(55, "Dense Drizzle"),
            Map.entry(61, "Slight Rain"),
            Map.entry(63, "Moderate Rain"),
            Map.entry(65, "Heavy Rain"),
            Map.entry(71, "Slight Snow"),
            Map.entry(73, "Moderate Snow"),
            Map.entry(75, "Heavy Snow"),
            Map.entry(77, "Snow Grains"),
            Map.entry(80, "Slight Showers"),
            Map.entry(81, "Moderate Showers"),
            Map.entry(82, "Violent Showers"),
            Map.entry(85, "Slight Snow Showers"),
            Map.entry(86, "Heavy Snow Showers"),
            Map.entry(95, "Thunderstorm"),
            Map.entry(96, "Thunderstorm with Hail"),
            Map.entry(99, "Thunderstorm with Hail")
    );

    private WeatherCodes() {}

    public static String describe(int code) {
        return DESCRIPTIONS.getOrDefault(code, "Unknown");
    }
}
