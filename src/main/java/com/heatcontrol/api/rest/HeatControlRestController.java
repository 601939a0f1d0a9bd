package com.heatcontrol.api.rest;

import com.heatcontrol.domain.model.POJOS.Decision;
import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.Schedule;
import com.heatcontrol.domain.model.api.dto.BatchIngestResponse;
import com.heatcontrol.domain.model.api.dto.HeatingStatusResponse;
import com.heatcontrol.domain.model.api.dto.MessageResponse;
import com.heatcontrol.domain.model.api.dto.RoomCreateRequest;
import com.heatcontrol.domain.model.api.dto.RoomResponse;
import com.heatcontrol.domain.model.api.dto.RoomSettingsRequest;
import com.heatcontrol.domain.model.api.dto.RoomSettingsResponse;
import com.heatcontrol.domain.model.api.dto.TargetResponse;
import com.heatcontrol.domain.model.api.dto.TemperatureBatchRequest;
import com.heatcontrol.domain.model.api.dto.TemperatureEntryRequest;
import com.heatcontrol.domain.model.api.dto.TemperatureResponse;
import com.heatcontrol.domain.model.exception.ExternalProviderException;
import com.heatcontrol.domain.model.exception.HeatControlException;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;
import com.heatcontrol.domain.model.exception.NoDataException;
import com.heatcontrol.domain.model.exception.NotFoundException;
import com.heatcontrol.domain.model.exception.StoreUnavailableException;
import com.heatcontrol.domain.service.HeatControlService;
import com.heatcontrol.domain.service.WeatherService;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller que expone la API pública del control de calefacción.
 * El dueño se toma del header X-Owner-Id; la autenticación queda fuera de este componente.
 *
 * Endpoints principales:
 * - POST/GET /api/rooms, DELETE /api/rooms/{roomId} - Alta, listado y baja de habitaciones
 * - GET/PUT /api/rooms/{roomId}/settings - Horario de la habitación
 * - POST /api/temperature, POST /api/temperature/batch - Registro de lecturas
 * - GET /api/temperature/{roomId}, GET /api/temperatures/all - Historial
 * - GET /api/weather, GET /api/weather_temperature - Clima actual e historial
 * - GET /api/heating_on/{roomId} - Decisión de calefacción
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class HeatControlRestController {

    private static final Logger logger = LoggerFactory.getLogger(HeatControlRestController.class);
    private static final String OWNER_HEADER = "X-Owner-Id";

    private final HeatControlService heatControlService;
    private final WeatherService weatherService;
    private final Clock clock;

    public HeatControlRestController(HeatControlService heatControlService, WeatherService weatherService, Clock clock) {
        this.heatControlService = heatControlService;
        this.weatherService = weatherService;
        this.clock = clock;
    }

    // --- Habitaciones ---

    /**
     * POST /api/rooms
     *
     * Body: { "name": "Living" }
     */
    @PostMapping("/rooms")
    public ResponseEntity<?> createRoom(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @RequestBody RoomCreateRequest request) {
        try {
            Room room = heatControlService.createRoom(ownerId, request.getName());
            return ResponseEntity.status(HttpStatus.CREATED).body(toRoomResponse(room));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/rooms")
    public ResponseEntity<List<RoomResponse>> listRooms(@RequestHeader(OWNER_HEADER) long ownerId) {
        List<RoomResponse> rooms = heatControlService.listRooms(ownerId).stream()
                .map(this::toRoomResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(rooms);
    }

    @DeleteMapping("/rooms/{roomId}")
    public ResponseEntity<?> deleteRoom(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId) {
        try {
            heatControlService.deleteRoom(ownerId, roomId);
            return ResponseEntity.ok(new MessageResponse("Habitación " + roomId + " borrada"));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/rooms/{roomId}/settings")
    public ResponseEntity<?> getSettings(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId) {
        try {
            Schedule schedule = heatControlService.getSchedule(ownerId, roomId);
            return ResponseEntity.ok(toSettingsResponse(roomId, schedule));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    /**
     * PUT /api/rooms/{roomId}/settings
     *
     * Reemplaza el horario completo; todos los campos son obligatorios.
     * Body:
     * {
     *   "timezone": "Europe/Berlin",
     *   "wanted_temp_day": 21.0,
     *   "wanted_temp_night": 18.0,
     *   "night_start": "22:00",
     *   "night_end": "06:00"
     * }
     */
    @PutMapping("/rooms/{roomId}/settings")
    public ResponseEntity<?> updateSettings(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId,
            @RequestBody RoomSettingsRequest request) {
        try {
            Schedule schedule = toSchedule(request);
            heatControlService.updateSchedule(ownerId, roomId, schedule);
            return ResponseEntity.ok(toSettingsResponse(roomId, schedule));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    /**
     * GET /api/rooms/{roomId}/target?at=2024-01-15T23:30:00Z
     *
     * Sin "at" se usa la hora actual.
     */
    @GetMapping("/rooms/{roomId}/target")
    public ResponseEntity<?> getTarget(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId,
            @RequestParam(required = false) String at) {
        try {
            // El tiempo se obtiene aquí y se pasa como parámetro al dominio
            Instant now = clock.instant();
            TimeBound bound = TimeBound.parse(at);
            Instant instant = bound != null ? bound.resolve(now) : now;
            double target = heatControlService.getTarget(roomId, ownerId, instant);
            return ResponseEntity.ok(new TargetResponse(roomId, instant.toString(), target));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    // --- Temperaturas ---

    /**
     * POST /api/temperature
     *
     * Body: { "room_id": 1, "temperature": 19.5 }
     */
    @PostMapping("/temperature")
    public ResponseEntity<?> recordTemperature(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @RequestBody TemperatureEntryRequest request) {
        try {
            if (request.getRoomId() == null || request.getTemperature() == null) {
                throw new InvalidArgumentException("room_id y temperature son obligatorios");
            }
            Sample sample = heatControlService.recordTemperature(ownerId, request.getRoomId(), request.getTemperature());
            return ResponseEntity.status(HttpStatus.CREATED).body(toTemperatureResponse(sample));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    /**
     * POST /api/temperature/batch
     *
     * Body:
     * {
     *   "room_id": 1,
     *   "temperatures": [19.5, 19.8],
     *   "timestamps": ["2024-10-27T10:30:00Z", "2024-10-27T10:35:00Z"]
     * }
     */
    @PostMapping("/temperature/batch")
    public ResponseEntity<?> recordBatch(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @RequestBody TemperatureBatchRequest request) {
        try {
            if (request.getRoomId() == null) {
                throw new InvalidArgumentException("room_id es obligatorio");
            }
            int count = heatControlService.ingestBatch(
                    ownerId, request.getRoomId(), request.getTemperatures(), request.getTimestamps());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new BatchIngestResponse("Se registraron " + count + " lecturas", count));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    /**
     * GET /api/temperature/{roomId}?start=-7d&end=now
     */
    @GetMapping("/temperature/{roomId}")
    public ResponseEntity<?> roomHistory(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        try {
            List<Sample> samples = heatControlService.roomHistory(
                    ownerId, roomId, TimeBound.parse(start), TimeBound.parse(end));
            return ResponseEntity.ok(toTemperatureResponses(samples));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/temperature/{roomId}/latest")
    public ResponseEntity<?> latestTemperature(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId) {
        try {
            Sample sample = heatControlService.latestTemperature(ownerId, roomId);
            return ResponseEntity.ok(toTemperatureResponse(sample));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/temperatures/all")
    public ResponseEntity<?> allRoomsHistory(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        try {
            List<Sample> samples = heatControlService.queryAllRooms(ownerId, TimeBound.parse(start), TimeBound.parse(end));
            return ResponseEntity.ok(toTemperatureResponses(samples));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    // --- Clima ---

    @GetMapping("/weather_temperature")
    public ResponseEntity<?> weatherHistory(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @RequestParam(required = false) String start,
            @RequestParam(required = false) String end) {
        try {
            List<Sample> samples = weatherService.weatherHistory(ownerId, TimeBound.parse(start), TimeBound.parse(end));
            return ResponseEntity.ok(toTemperatureResponses(samples));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    @GetMapping("/weather")
    public ResponseEntity<?> currentWeather(@RequestHeader(OWNER_HEADER) long ownerId) {
        try {
            return ResponseEntity.ok(weatherService.currentWeather(ownerId));
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    // --- Decisión ---

    /**
     * GET /api/heating_on/{roomId}
     *
     * Retorna:
     * {
     *   "room_id": 1,
     *   "target_temperature": 18.0,
     *   "current_temperature": 17.5,
     *   "measured_at": "2024-01-15T23:25:00Z",
     *   "heating_on": true
     * }
     */
    @GetMapping("/heating_on/{roomId}")
    public ResponseEntity<?> heatingOn(
            @RequestHeader(OWNER_HEADER) long ownerId,
            @PathVariable long roomId) {
        try {
            Decision decision = heatControlService.decide(roomId, ownerId);
            return ResponseEntity.ok(HeatingStatusResponse.builder()
                    .roomId(decision.getRoomId())
                    .targetTemperature(decision.getTargetTemperature())
                    .currentTemperature(decision.getLatestSample().getValue())
                    .measuredAt(decision.getLatestSample().getTimestamp().toString())
                    .heatingOn(decision.isHeatingOn())
                    .build());
        } catch (HeatControlException e) {
            return errorResponse(e);
        }
    }

    /**
     * Health check endpoint.
     *
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("UP", "Heat Control System is running"));
    }

    // --- Mapeos ---

    private ResponseEntity<MessageResponse> errorResponse(HeatControlException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            logger.error("Error atendiendo la solicitud: {}", e.getMessage());
        } else {
            logger.debug("Solicitud rechazada ({}): {}", status.value(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new MessageResponse(e.getMessage()));
    }

    public static HttpStatus statusFor(HeatControlException e) {
        if (e instanceof NotFoundException || e instanceof NoDataException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof InvalidArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof StoreUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof ExternalProviderException) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Schedule toSchedule(RoomSettingsRequest request) {
        if (request.getTimezone() == null || request.getWantedTempDay() == null || request.getWantedTempNight() == null
                || request.getNightStart() == null || request.getNightEnd() == null) {
            throw new InvalidArgumentException(
                    "timezone, wanted_temp_day, wanted_temp_night, night_start y night_end son obligatorios");
        }
        try {
            return new Schedule(
                    request.getTimezone(),
                    request.getWantedTempDay(),
                    request.getWantedTempNight(),
                    LocalTime.parse(request.getNightStart()),
                    LocalTime.parse(request.getNightEnd()));
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException("Hora inválida, se espera HH:mm: " + e.getParsedString(), e);
        }
    }

    private RoomResponse toRoomResponse(Room room) {
        return new RoomResponse(room.getId(), room.getName(), room.getSensorTopic());
    }

    private RoomSettingsResponse toSettingsResponse(long roomId, Schedule schedule) {
        return RoomSettingsResponse.builder()
                .roomId(roomId)
                .timezone(schedule.getTimezone())
                .wantedTempDay(schedule.getTargetDay())
                .wantedTempNight(schedule.getTargetNight())
                .nightStart(schedule.getNightStart().toString())
                .nightEnd(schedule.getNightEnd().toString())
                .build();
    }

    private TemperatureResponse toTemperatureResponse(Sample sample) {
        return new TemperatureResponse(
                sample.getTimestamp().toString(),
                sample.getValue(),
                sample.getSeriesKey().getRoomId());
    }

    private List<TemperatureResponse> toTemperatureResponses(List<Sample> samples) {
        return samples.stream()
                .map(this::toTemperatureResponse)
                .collect(Collectors.toList());
    }

    private static class HealthResponse {
        private final String status;
        private final String message;

        public HealthResponse(String status, String message) {
            this.status = status;
            this.message = message;
        }

        public String getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }
}
