package com.heatcontrol.domain.service;

import com.heatcontrol.domain.model.Controllers.HeatingDecisionEngine;
import com.heatcontrol.domain.model.POJOS.Decision;
import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.Schedule;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;
import com.heatcontrol.domain.model.exception.NoDataException;
import com.heatcontrol.domain.model.exception.NotFoundException;
import com.heatcontrol.domain.model.exception.StoreUnavailableException;
import com.heatcontrol.infrastructure.repository.IRoomRepository;
import com.heatcontrol.infrastructure.telemetry.TelemetryStoreAdapter;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import com.heatcontrol.infrastructure.telemetry.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Servicio que coordina habitaciones, horarios y telemetría de temperatura.
 * Actúa como intermediario entre el REST Controller (o cualquier otro consumidor)
 * y la lógica de decisión, obteniendo aquí el tiempo actual y pasándolo como parámetro.
 */
@Service
public class HeatControlService {

    private static final Logger logger = LoggerFactory.getLogger(HeatControlService.class);

    private final IRoomRepository roomRepository;
    private final TelemetryStoreAdapter telemetryStore;
    private final HeatingDecisionEngine decisionEngine;
    private final BatchIngestionService batchIngestionService;
    private final Clock clock;
    private final Duration lookbackWindow;

    public HeatControlService(
            IRoomRepository roomRepository,
            TelemetryStoreAdapter telemetryStore,
            HeatingDecisionEngine decisionEngine,
            BatchIngestionService batchIngestionService,
            Clock clock,
            @Value("${heat-control.decision.lookback-days:7}") long lookbackDays) {
        this.roomRepository = roomRepository;
        this.telemetryStore = telemetryStore;
        this.decisionEngine = decisionEngine;
        this.batchIngestionService = batchIngestionService;
        this.clock = clock;
        this.lookbackWindow = Duration.ofDays(lookbackDays);
    }

    // --- Decisión ---

    /**
     * Decide si la calefacción de la habitación debe estar encendida ahora.
     * Solo lectura: no modifica el almacén.
     *
     * @throws NotFoundException si la habitación o su horario no existen para el dueño
     * @throws NoDataException   si no hay lecturas en la ventana de búsqueda (7 días por defecto)
     */
    public Decision decide(long roomId, long ownerId) {
        Schedule schedule = requireSchedule(ownerId, roomId);
        Instant now = clock.instant();

        Sample latest = telemetryStore.latest(SeriesKey.room(ownerId, roomId), lookbackWindow)
                .orElseThrow(() -> new NoDataException("No hay datos de temperatura para la habitación " + roomId));

        Decision decision = evaluate(roomId, schedule, latest, now);
        logger.debug("Decisión para habitación {}: objetivo {}°C, actual {}°C, calefacción {}",
                roomId, decision.getTargetTemperature(), latest.getValue(), decision.isHeatingOn() ? "ON" : "OFF");
        return decision;
    }

    /**
     * Temperatura objetivo de la habitación en un instante dado.
     */
    public double getTarget(long roomId, long ownerId, Instant at) {
        Schedule schedule = requireSchedule(ownerId, roomId);
        try {
            return decisionEngine.getTargetResolver().resolveTarget(schedule, at);
        } catch (DateTimeException e) {
            throw invalidTimezone(roomId, schedule, e);
        }
    }

    // --- Habitaciones y horarios ---

    public Room createRoom(long ownerId, String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidArgumentException("El nombre de la habitación es obligatorio");
        }
        Room room = roomRepository.createRoom(ownerId, name.trim());
        logger.info("Habitación creada: {} (dueño {}) con horario por defecto", room.getId(), ownerId);
        return room;
    }

    public List<Room> listRooms(long ownerId) {
        return roomRepository.findRooms(ownerId);
    }

    /**
     * Borra la habitación, su horario y sus lecturas de temperatura.
     * El borrado de lecturas se limita a la serie (dueño, habitación); el clima exterior no se toca.
     * Si el almacén de series no responde, la habitación se borra igual y las lecturas quedan huérfanas.
     */
    public void deleteRoom(long ownerId, long roomId) {
        requireRoom(ownerId, roomId);
        try {
            int deleted = telemetryStore.deleteSeries(SeriesKey.room(ownerId, roomId));
            logger.info("Borradas {} lecturas de la habitación {}", deleted, roomId);
        } catch (StoreUnavailableException e) {
            logger.warn("No se pudieron borrar las lecturas de la habitación {}: {}", roomId, e.getMessage());
        }
        roomRepository.deleteRoom(ownerId, roomId);
        logger.info("Habitación {} del dueño {} borrada", roomId, ownerId);
    }

    public Schedule getSchedule(long ownerId, long roomId) {
        return requireSchedule(ownerId, roomId);
    }

    public void updateSchedule(long ownerId, long roomId, Schedule schedule) {
        try {
            ZoneId.of(schedule.getTimezone());
        } catch (DateTimeException e) {
            throw new InvalidArgumentException("Zona horaria desconocida: " + schedule.getTimezone(), e);
        }
        if (!roomRepository.updateSchedule(ownerId, roomId, schedule)) {
            throw new NotFoundException("Habitación no encontrada: " + roomId);
        }
        logger.info("Horario actualizado para habitación {}: {}", roomId, schedule);
    }

    // --- Telemetría de habitaciones ---

    /**
     * Registra una lectura con la hora actual.
     */
    public Sample recordTemperature(long ownerId, long roomId, double temperature) {
        requireRoom(ownerId, roomId);
        return telemetryStore.append(SeriesKey.room(ownerId, roomId), temperature, clock.instant());
    }

    /**
     * Registra una lectura con un instante propio (usado por la ingesta MQTT).
     */
    public Sample recordTemperature(long ownerId, long roomId, double temperature, Instant timestamp) {
        requireRoom(ownerId, roomId);
        return telemetryStore.append(SeriesKey.room(ownerId, roomId), temperature, timestamp);
    }

    public int ingestBatch(long ownerId, long roomId, List<Double> values, List<String> timestamps) {
        requireRoom(ownerId, roomId);
        return batchIngestionService.ingestBatch(SeriesKey.room(ownerId, roomId), values, timestamps);
    }

    public Sample latestTemperature(long ownerId, long roomId) {
        requireRoom(ownerId, roomId);
        return telemetryStore.latest(SeriesKey.room(ownerId, roomId), lookbackWindow)
                .orElseThrow(() -> new NoDataException("No hay datos de temperatura para la habitación " + roomId));
    }

    /**
     * Consulta por rango sobre cualquier serie, sin verificar pertenencia.
     */
    public List<Sample> queryRange(SeriesKey seriesKey, TimeBound start, TimeBound end) {
        return telemetryStore.range(seriesKey, start, end);
    }

    public List<Sample> roomHistory(long ownerId, long roomId, TimeBound start, TimeBound end) {
        requireRoom(ownerId, roomId);
        return queryRange(SeriesKey.room(ownerId, roomId), start, end);
    }

    /**
     * Historial de todas las habitaciones del dueño, ordenado por instante.
     */
    public List<Sample> queryAllRooms(long ownerId, TimeBound start, TimeBound end) {
        TimeRange range = TimeRange.resolve(start, end, clock.instant(), telemetryStore.getDefaultWindow());
        List<Sample> merged = new ArrayList<>();
        for (Room room : roomRepository.findRooms(ownerId)) {
            merged.addAll(telemetryStore.range(room.seriesKey(), range));
        }
        // sort es estable: los instantes repetidos mantienen el orden por habitación
        merged.sort(Comparator.comparing(Sample::getTimestamp));
        return merged;
    }

    // --- Helpers ---

    private Decision evaluate(long roomId, Schedule schedule, Sample latest, Instant now) {
        try {
            return decisionEngine.evaluate(roomId, schedule, latest, now);
        } catch (DateTimeException e) {
            throw invalidTimezone(roomId, schedule, e);
        }
    }

    private Room requireRoom(long ownerId, long roomId) {
        return roomRepository.findRoom(ownerId, roomId)
                .orElseThrow(() -> new NotFoundException("Habitación no encontrada: " + roomId));
    }

    private Schedule requireSchedule(long ownerId, long roomId) {
        requireRoom(ownerId, roomId);
        return roomRepository.getSchedule(ownerId, roomId)
                .orElseThrow(() -> new NotFoundException("Horario no encontrado para la habitación " + roomId));
    }

    private InvalidArgumentException invalidTimezone(long roomId, Schedule schedule, DateTimeException e) {
        logger.error("Zona horaria inválida '{}' en el horario de la habitación {}", schedule.getTimezone(), roomId);
        return new InvalidArgumentException("Zona horaria inválida en el horario de la habitación " + roomId
                + ": " + schedule.getTimezone(), e);
    }
}
