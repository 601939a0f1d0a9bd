package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.exception.StoreUnavailableException;

import java.time.Instant;
import java.util.List;

/**
 * Almacén de series de tiempo (solo agregar, consultar por rango y borrar por rango).
 * Las muestras son inmutables; dentro de una serie se ordenan por instante y
 * los instantes repetidos conservan el orden de escritura.
 */
public interface ITelemetryStore {

    /**
     * Escribe las muestras como una sola operación. Si falla, el llamador no
     * puede asumir que se haya persistido ningún subconjunto.
     */
    void write(List<Sample> samples) throws StoreUnavailableException;

    /**
     * Devuelve las muestras de la consulta en orden ascendente por instante.
     * Con latestOnly devuelve como mucho una muestra: la más reciente.
     */
    List<Sample> query(TelemetryQuery query) throws StoreUnavailableException;

    /**
     * Borra las muestras de la serie con start <= instante < stop.
     *
     * @return cantidad de muestras borradas
     */
    int delete(SeriesKey seriesKey, Instant start, Instant stop) throws StoreUnavailableException;
}
