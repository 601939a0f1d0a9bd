package com.heatcontrol.domain.model.POJOS;

// Lectura actual devuelta por el proveedor de clima
public class WeatherObservation {
    private final double temperature;
    private final int weatherCode;
    private final String observedAt; // hora local informada por el proveedor, puede ser null

    public WeatherObservation(double temperature, int weatherCode, String observedAt) {
        this.temperature = temperature;
        this.weatherCode = weatherCode;
        this.observedAt = observedAt;
    }

    public double getTemperature() { return temperature; }
    public int getWeatherCode() { return weatherCode; }
    public String getObservedAt() { return observedAt; }

    @Override
    public String toString() {
        return "WeatherObservation{" +
                "temperature=" + temperature +
                ", weatherCode=" + weatherCode +
                ", observedAt='" + observedAt + '\'' +
                '}';
    }
}
