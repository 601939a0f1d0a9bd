package com.heatcontrol.domain.service;

import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;
import com.heatcontrol.infrastructure.telemetry.TelemetryStoreAdapter;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ingesta de lotes de valores para una serie.
 *
 * Cada valor usa el timestamp de su misma posición si se puede parsear;
 * si falta o es inválido se usa "ahora" al momento de procesar ese valor.
 * No se comparte un único "ahora" para todo el lote, así que dos valores
 * seguidos pueden quedar con el mismo instante.
 */
@Service
public class BatchIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(BatchIngestionService.class);

    /** Tope absoluto de valores por lote; la configuración solo puede bajarlo. */
    public static final int MAX_BATCH_SIZE = 100;

    private final TelemetryStoreAdapter telemetryStore;
    private final Clock clock;
    private final int maxBatchSize;

    public BatchIngestionService(
            TelemetryStoreAdapter telemetryStore,
            Clock clock,
            @Value("${heat-control.ingestion.max-batch-size:100}") int maxBatchSize) {
        this.telemetryStore = telemetryStore;
        this.clock = clock;
        if (maxBatchSize > MAX_BATCH_SIZE) {
            logger.warn("max-batch-size={} supera el tope de {} valores por lote, se usa {}",
                    maxBatchSize, MAX_BATCH_SIZE, MAX_BATCH_SIZE);
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("max-batch-size debe ser al menos 1: " + maxBatchSize);
        }
        this.maxBatchSize = Math.min(maxBatchSize, MAX_BATCH_SIZE);
    }

    /**
     * @param seriesKey  serie destino
     * @param values     valores en orden
     * @param timestamps timestamps ISO-8601 opcionales, alineados por índice con los valores (puede ser null o más corta)
     * @return cantidad de valores aceptados
     */
    public int ingestBatch(SeriesKey seriesKey, List<Double> values, List<String> timestamps) {
        if (values == null) {
            throw new InvalidArgumentException("La lista de valores es obligatoria");
        }
        if (values.size() > maxBatchSize) {
            throw new InvalidArgumentException("Máximo " + maxBatchSize + " valores por lote, se recibieron " + values.size());
        }

        List<Sample> samples = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value == null || value.isNaN() || value.isInfinite()) {
                throw new InvalidArgumentException("Valor inválido en la posición " + i + ": " + value);
            }
            samples.add(new Sample(seriesKey, value, timestampFor(timestamps, i)));
        }

        telemetryStore.appendBatch(seriesKey, samples);
        logger.info("Lote de {} valores registrado en {}", samples.size(), seriesKey);
        return samples.size();
    }

    private Instant timestampFor(List<String> timestamps, int index) {
        if (timestamps == null || index >= timestamps.size()) {
            return clock.instant();
        }
        String raw = timestamps.get(index);
        if (raw == null || raw.isBlank()) {
            return clock.instant();
        }
        try {
            return TimeBound.parseInstant(raw);
        } catch (InvalidArgumentException e) {
            logger.warn("Timestamp inválido en la posición {} ('{}'), se usa la hora actual", index, raw);
            return clock.instant();
        }
    }
}
