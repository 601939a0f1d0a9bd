package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementación en memoria del almacén de series.
 * Cada serie es una lista ordenada por instante, protegida por su propio lock,
 * así que escrituras en series distintas no se bloquean entre sí.
 */
public class InMemoryTelemetryStore implements ITelemetryStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTelemetryStore.class);

    private final Map<SeriesKey, List<Sample>> series = new ConcurrentHashMap<>();

    @Override
    public void write(List<Sample> samples) {
        // Validar todo antes de tocar ninguna serie
        for (Sample sample : samples) {
            Objects.requireNonNull(sample, "sample");
        }

        Map<SeriesKey, List<Sample>> byKey = new LinkedHashMap<>();
        for (Sample sample : samples) {
            byKey.computeIfAbsent(sample.getSeriesKey(), k -> new ArrayList<>()).add(sample);
        }

        for (Map.Entry<SeriesKey, List<Sample>> entry : byKey.entrySet()) {
            List<Sample> target = series.computeIfAbsent(entry.getKey(), k -> new ArrayList<>());
            synchronized (target) {
                for (Sample sample : entry.getValue()) {
                    target.add(upperBound(target, sample.getTimestamp()), sample);
                }
            }
        }
        logger.debug("Escritas {} muestras en {} series", samples.size(), byKey.size());
    }

    @Override
    public List<Sample> query(TelemetryQuery query) {
        List<Sample> target = series.get(query.getSeriesKey());
        if (target == null) {
            return Collections.emptyList();
        }

        synchronized (target) {
            int from = lowerBound(target, query.getStart());
            int to = query.isStopInclusive()
                    ? upperBound(target, query.getStop())
                    : lowerBound(target, query.getStop());
            if (from >= to) {
                return Collections.emptyList();
            }
            if (query.isLatestOnly()) {
                return List.of(target.get(to - 1));
            }
            return new ArrayList<>(target.subList(from, to));
        }
    }

    @Override
    public int delete(SeriesKey seriesKey, Instant start, Instant stop) {
        List<Sample> target = series.get(seriesKey);
        if (target == null) {
            return 0;
        }
        synchronized (target) {
            int from = lowerBound(target, start);
            int to = lowerBound(target, stop);
            if (from >= to) {
                return 0;
            }
            target.subList(from, to).clear();
            return to - from;
        }
    }

    // Primer índice con instante >= t
    private static int lowerBound(List<Sample> samples, Instant t) {
        int low = 0;
        int high = samples.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (samples.get(mid).getTimestamp().isBefore(t)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // Primer índice con instante > t
    private static int upperBound(List<Sample> samples, Instant t) {
        int low = 0;
        int high = samples.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (samples.get(mid).getTimestamp().isAfter(t)) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
