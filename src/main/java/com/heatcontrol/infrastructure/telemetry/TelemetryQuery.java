package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.POJOS.SeriesKey;

import java.time.Instant;
import java.util.Objects;

/**
 * Consulta estructurada sobre una serie de tiempo.
 * Los identificadores viajan como campos tipados; nunca se arma texto de consulta con datos del usuario.
 */
public final class TelemetryQuery {

    private final SeriesKey seriesKey;
    private final Instant start;
    private final Instant stop;
    private final boolean stopInclusive;
    private final boolean latestOnly;

    private TelemetryQuery(Builder builder) {
        this.seriesKey = builder.seriesKey;
        this.start = builder.start;
        this.stop = builder.stop;
        this.stopInclusive = builder.stopInclusive;
        this.latestOnly = builder.latestOnly;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SeriesKey getSeriesKey() { return seriesKey; }
    public Instant getStart() { return start; }
    public Instant getStop() { return stop; }
    public boolean isStopInclusive() { return stopInclusive; }
    public boolean isLatestOnly() { return latestOnly; }

    @Override
    public String toString() {
        return "TelemetryQuery{" +
                "series=" + seriesKey +
                ", start=" + start +
                ", stop=" + stop +
                (stopInclusive ? "]" : ")") +
                (latestOnly ? ", latest" : "") +
                '}';
    }

    public static final class Builder {
        private SeriesKey seriesKey;
        private Instant start;
        private Instant stop;
        private boolean stopInclusive;
        private boolean latestOnly;

        private Builder() {}

        public Builder series(SeriesKey seriesKey) {
            this.seriesKey = seriesKey;
            return this;
        }

        public Builder range(TimeRange range) {
            this.start = range.getStart();
            this.stop = range.getEnd();
            this.stopInclusive = false;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder stop(Instant stop) {
            this.stop = stop;
            return this;
        }

        public Builder stopInclusive(boolean stopInclusive) {
            this.stopInclusive = stopInclusive;
            return this;
        }

        public Builder latestOnly() {
            this.latestOnly = true;
            return this;
        }

        public TelemetryQuery build() {
            Objects.requireNonNull(seriesKey, "seriesKey");
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(stop, "stop");
            if (start.isAfter(stop)) {
                throw new IllegalStateException("start posterior a stop: " + start + " > " + stop);
            }
            return new TelemetryQuery(this);
        }
    }
}
