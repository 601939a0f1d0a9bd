package com.heatcontrol.domain.model.POJOS;

import java.time.Instant;
import java.util.Objects;

// Muestra inmutable de una serie: valor + instante
public class Sample {
    private final SeriesKey seriesKey;
    private final double value;
    private final Instant timestamp;

    public Sample(SeriesKey seriesKey, double value, Instant timestamp) {
        this.seriesKey = Objects.requireNonNull(seriesKey, "seriesKey");
        this.value = value;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    public double getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    // Necesario para que AssertJ pueda comparar objetos en las pruebas
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sample sample = (Sample) o;
        return Double.compare(sample.value, value) == 0 &&
                seriesKey.equals(sample.seriesKey) &&
                timestamp.equals(sample.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesKey, value, timestamp);
    }

    @Override
    public String toString() {
        return "Sample{" +
                "seriesKey=" + seriesKey +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
