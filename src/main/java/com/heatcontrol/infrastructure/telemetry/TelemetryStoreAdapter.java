package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.exception.HeatControlException;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;
import com.heatcontrol.domain.model.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Adaptador sobre el almacén de series de tiempo.
 * Arma las consultas acotadas en el tiempo y traduce cualquier falla del almacén
 * a StoreUnavailableException. No hay caché: cada llamada va al almacén.
 */
@Component
public class TelemetryStoreAdapter {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryStoreAdapter.class);

    private final ITelemetryStore store;
    private final Clock clock;
    private final Duration defaultWindow;

    public TelemetryStoreAdapter(
            ITelemetryStore store,
            Clock clock,
            @Value("${heat-control.query.default-window-hours:24}") long defaultWindowHours) {
        this.store = store;
        this.clock = clock;
        this.defaultWindow = Duration.ofHours(defaultWindowHours);
    }

    /**
     * Escribe una sola muestra. No es idempotente: reintentar puede duplicarla.
     */
    public Sample append(SeriesKey seriesKey, double value, Instant timestamp) {
        Sample sample = new Sample(seriesKey, value, timestamp);
        write(List.of(sample));
        logger.debug("Muestra agregada: {}", sample);
        return sample;
    }

    /**
     * Escribe un lote ordenado como una sola escritura, sin reintentos internos.
     * Todas las muestras deben pertenecer a la serie indicada.
     */
    public void appendBatch(SeriesKey seriesKey, List<Sample> samples) {
        for (Sample sample : samples) {
            if (!seriesKey.equals(sample.getSeriesKey())) {
                throw new InvalidArgumentException("La muestra " + sample + " no pertenece a la serie " + seriesKey);
            }
        }
        if (samples.isEmpty()) {
            return;
        }
        write(samples);
        logger.debug("Lote de {} muestras agregado a {}", samples.size(), seriesKey);
    }

    /**
     * Muestra más reciente con instante dentro de [ahora - lookback, ahora].
     */
    public Optional<Sample> latest(SeriesKey seriesKey, Duration lookbackWindow) {
        Instant now = clock.instant();
        TelemetryQuery query = TelemetryQuery.builder()
                .series(seriesKey)
                .start(now.minus(lookbackWindow))
                .stop(now)
                .stopInclusive(true)
                .latestOnly()
                .build();
        List<Sample> result = execute(query);
        return result.isEmpty() ? Optional.empty() : Optional.of(result.get(result.size() - 1));
    }

    /**
     * Muestras con start <= instante < end, en orden ascendente.
     * Sin end se usa "ahora"; sin start, 24 horas (configurable) antes del end.
     */
    public List<Sample> range(SeriesKey seriesKey, TimeBound start, TimeBound end) {
        TimeRange range = TimeRange.resolve(start, end, clock.instant(), defaultWindow);
        return range(seriesKey, range);
    }

    public List<Sample> range(SeriesKey seriesKey, TimeRange range) {
        if (range.isEmpty()) {
            return Collections.emptyList();
        }
        TelemetryQuery query = TelemetryQuery.builder()
                .series(seriesKey)
                .range(range)
                .build();
        return execute(query);
    }

    /**
     * Borra todas las muestras de la serie, incluidas las anteriores a 1970
     * o con instante futuro que pudo haber cargado un lote.
     */
    public int deleteSeries(SeriesKey seriesKey) {
        try {
            int deleted = store.delete(seriesKey, Instant.MIN, Instant.MAX);
            logger.debug("Borradas {} muestras de {}", deleted, seriesKey);
            return deleted;
        } catch (HeatControlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("No se pudo borrar la serie " + seriesKey + ": " + e.getMessage(), e);
        }
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    private void write(List<Sample> samples) {
        try {
            store.write(samples);
        } catch (HeatControlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("No se pudo escribir en el almacén de series: " + e.getMessage(), e);
        }
    }

    private List<Sample> execute(TelemetryQuery query) {
        try {
            logger.debug("Ejecutando consulta {}", query);
            return store.query(query);
        } catch (HeatControlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("No se pudo consultar el almacén de series: " + e.getMessage(), e);
        }
    }
}
