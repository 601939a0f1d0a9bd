package com.heatcontrol.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heatcontrol.domain.model.Controllers.HeatingDecisionEngine;
import com.heatcontrol.domain.model.Controllers.TargetResolver;
import com.heatcontrol.domain.model.Logica.IWeatherProvider;
import com.heatcontrol.domain.model.Logica.OpenMeteoWeatherProvider;
import com.heatcontrol.domain.model.POJOS.Location;
import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Schedule;
import com.heatcontrol.infrastructure.repository.ILocationDirectory;
import com.heatcontrol.infrastructure.repository.IRoomRepository;
import com.heatcontrol.infrastructure.repository.InMemoryLocationDirectory;
import com.heatcontrol.infrastructure.repository.InMemoryRoomRepository;
import com.heatcontrol.infrastructure.telemetry.ITelemetryStore;
import com.heatcontrol.infrastructure.telemetry.InMemoryTelemetryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuración que carga el JSON del sitio (dueños, ubicaciones, habitaciones y horarios)
 * y crea los beans del sistema de control de calefacción.
 */
@Configuration
public class HeatControlConfig {

    private static final Logger logger = LoggerFactory.getLogger(HeatControlConfig.class);

    @Value("${heat-control.config-file:classpath:site-config.json}")
    private String configLocation;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResourceLoader resourceLoader;

    public HeatControlConfig(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Carga la configuración del sitio desde el JSON.
     * Acepta algunas claves legacy ("siteName", "lat"/"lon", "sensorTopic").
     */
    @Bean
    public SiteConfiguration siteConfiguration() throws IOException {
        Resource resource = resolveConfigResource();

        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(inputStream);

            String siteName = root.has("site")
                    ? root.get("site").asText()
                    : root.path("siteName").asText("heat-control");

            List<OwnerConfig> owners = new ArrayList<>();
            JsonNode ownersNode = root.path("owners");
            if (ownersNode.isArray()) {
                for (JsonNode ownerNode : ownersNode) {
                    owners.add(parseOwner(ownerNode));
                }
            }

            logger.info("Configuración del sitio '{}' cargada: {} dueños", siteName, owners.size());
            return new SiteConfiguration(siteName, owners);
        }
    }

    private OwnerConfig parseOwner(JsonNode ownerNode) {
        long ownerId = ownerNode.get("id").asLong();

        // latitude/longitude (legacy: lat/lon). Sin coordenadas el dueño no tiene ubicación.
        Double latitude = readDouble(ownerNode, "latitude", "lat");
        Double longitude = readDouble(ownerNode, "longitude", "lon");

        List<RoomConfig> rooms = new ArrayList<>();
        JsonNode roomsNode = ownerNode.path("rooms");
        if (roomsNode.isArray()) {
            for (JsonNode roomNode : roomsNode) {
                long id = roomNode.get("id").asLong();
                String name = roomNode.has("name") ? roomNode.get("name").asText() : "room-" + id;

                // sensor (legacy: sensorTopic)
                String sensorTopic = roomNode.has("sensor")
                        ? roomNode.get("sensor").asText()
                        : roomNode.path("sensorTopic").asText(null);

                rooms.add(new RoomConfig(id, name, sensorTopic, parseSchedule(roomNode.get("schedule"))));
            }
        }
        return new OwnerConfig(ownerId, latitude, longitude, rooms);
    }

    /**
     * Los campos ausentes toman los valores por defecto del horario.
     * La zona horaria no se valida aquí: una zona inválida aparece al resolver el objetivo.
     */
    private Schedule parseSchedule(JsonNode scheduleNode) {
        if (scheduleNode == null || scheduleNode.isNull()) {
            return Schedule.defaults();
        }

        String timezone = scheduleNode.path("timezone").asText(Schedule.DEFAULT_TIMEZONE);

        double targetDay = readTemperature(scheduleNode, "wanted_temp_day", Schedule.DEFAULT_TARGET_DAY);
        double targetNight = readTemperature(scheduleNode, "wanted_temp_night", Schedule.DEFAULT_TARGET_NIGHT);

        LocalTime nightStart = parseTime(scheduleNode, "night_start", Schedule.DEFAULT_NIGHT_START);
        LocalTime nightEnd = parseTime(scheduleNode, "night_end", Schedule.DEFAULT_NIGHT_END);

        return new Schedule(timezone, targetDay, targetNight, nightStart, nightEnd);
    }

    private LocalTime parseTime(JsonNode node, String field, LocalTime defaultValue) {
        if (!node.has(field)) {
            return defaultValue;
        }
        String text = node.get(field).asText();
        try {
            return LocalTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time for " + field + ": " + text, e);
        }
    }

    private Double readDouble(JsonNode node, String field, String legacyField) {
        if (node.has(field)) {
            return node.get(field).asDouble();
        }
        if (node.has(legacyField)) {
            return node.get(legacyField).asDouble();
        }
        return null;
    }

    /**
     * Lee una temperatura numérica. También acepta el número como string ("21.5"),
     * pero no unidades ni otro texto.
     */
    private double readTemperature(JsonNode node, String field, double defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        String text = value.asText().trim();
        try {
            double parsed = Double.parseDouble(text);
            if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
                throw new IllegalArgumentException("Invalid temperature for " + field + ": " + text);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid temperature for " + field + ": " + text, e);
        }
    }

    private Resource resolveConfigResource() throws IOException {
        Resource resource = resourceLoader.getResource(configLocation);
        if (resource.exists()) {
            return resource;
        }

        // Si no tiene prefijo, interpretarlo como ruta absoluta o relativa en el filesystem
        if (!configLocation.startsWith("classpath:") && !configLocation.startsWith("file:")) {
            Path path = Path.of(configLocation).toAbsolutePath();
            if (Files.exists(path)) {
                return resourceLoader.getResource("file:" + path);
            }
        }

        logger.warn("No se encontró el archivo de configuración en '{}'. Usando fallback del classpath.", configLocation);
        Resource fallback = resourceLoader.getResource("classpath:site-config.json");
        if (!fallback.exists()) {
            throw new IOException("No se encontró la configuración del sitio ni en " + configLocation + " ni en classpath:site-config.json");
        }
        return fallback;
    }

    /**
     * Reloj de la aplicación. Solo la infraestructura y los servicios lo consultan;
     * el dominio recibe el instante como parámetro.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ITelemetryStore telemetryStore() {
        return new InMemoryTelemetryStore();
    }

    /**
     * Repositorio de habitaciones sembrado con las habitaciones del JSON.
     */
    @Bean
    public IRoomRepository roomRepository(SiteConfiguration config) {
        InMemoryRoomRepository repository = new InMemoryRoomRepository();
        for (OwnerConfig owner : config.getOwners()) {
            for (RoomConfig roomConfig : owner.getRooms()) {
                Room room = new Room(roomConfig.getId(), owner.getId(), roomConfig.getName(), roomConfig.getSensorTopic());
                repository.addRoom(room, roomConfig.getSchedule());
            }
        }
        logger.info("Repositorio de habitaciones inicializado con {} habitaciones del sitio '{}'",
                repository.findAll().size(), config.getSiteName());
        return repository;
    }

    @Bean
    public ILocationDirectory locationDirectory(SiteConfiguration config) {
        List<Location> locations = new ArrayList<>();
        for (OwnerConfig owner : config.getOwners()) {
            if (owner.getLatitude() != null && owner.getLongitude() != null) {
                locations.add(new Location(owner.getId(), owner.getLatitude(), owner.getLongitude()));
            } else {
                logger.debug("Dueño {} sin ubicación configurada", owner.getId());
            }
        }
        return new InMemoryLocationDirectory(locations);
    }

    @Bean
    public TargetResolver targetResolver() {
        return new TargetResolver();
    }

    @Bean
    public HeatingDecisionEngine heatingDecisionEngine(TargetResolver targetResolver) {
        return new HeatingDecisionEngine(targetResolver);
    }

    @Bean
    public IWeatherProvider weatherProvider(
            @Value("${weather.api.base-url:https://api.open-meteo.com/v1/forecast}") String baseUrl,
            @Value("${weather.api.timeout-seconds:5}") long timeoutSeconds) {
        return new OpenMeteoWeatherProvider(baseUrl, Duration.ofSeconds(timeoutSeconds));
    }

    // Clases internas para configuración
    public static class SiteConfiguration {
        private final String siteName;
        private final List<OwnerConfig> owners;

        public SiteConfiguration(String siteName, List<OwnerConfig> owners) {
            this.siteName = siteName;
            this.owners = owners;
        }

        public String getSiteName() {
            return siteName;
        }

        public List<OwnerConfig> getOwners() {
            return owners;
        }
    }

    public static class OwnerConfig {
        private final long id;
        private final Double latitude;
        private final Double longitude;
        private final List<RoomConfig> rooms;

        public OwnerConfig(long id, Double latitude, Double longitude, List<RoomConfig> rooms) {
            this.id = id;
            this.latitude = latitude;
            this.longitude = longitude;
            this.rooms = rooms;
        }

        public long getId() { return id; }
        public Double getLatitude() { return latitude; }
        public Double getLongitude() { return longitude; }
        public List<RoomConfig> getRooms() { return rooms; }
    }

    public static class RoomConfig {
        private final long id;
        private final String name;
        private final String sensorTopic;
        private final Schedule schedule;

        public RoomConfig(long id, String name, String sensorTopic, Schedule schedule) {
            this.id = id;
            this.name = name;
            this.sensorTopic = sensorTopic;
            this.schedule = schedule;
        }

        public long getId() { return id; }
        public String getName() { return name; }
        public String getSensorTopic() { return sensorTopic; }
        public Schedule getSchedule() { return schedule; }
    }
}
