package com.heatcontrol.domain.model.POJOS;

// Familias lógicas de series de tiempo que maneja el sistema
public enum SeriesFamily {
    ROOM_TEMPERATURE("temperature"),
    OUTDOOR_WEATHER("weather_temperature");

    private final String measurement;

    SeriesFamily(String measurement) {
        this.measurement = measurement;
    }

    public String getMeasurement() {
        return measurement;
    }
}
