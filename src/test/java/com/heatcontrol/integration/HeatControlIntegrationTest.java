package com.heatcontrol.integration;

import com.heatcontrol.HeatControlApplication;
import com.heatcontrol.domain.model.Logica.IWeatherProvider;
import com.heatcontrol.domain.model.POJOS.WeatherObservation;
import com.heatcontrol.domain.model.exception.ExternalProviderException;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;
import java.util.stream.Collectors;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests de integración para los endpoints REST del control de calefacción.
 *
 * El contexto se comparte entre tests, así que cada test crea sus propias habitaciones
 * con nombres distintos para no depender del orden de ejecución.
 */
@SpringBootTest(classes = HeatControlApplication.class)
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "mqtt.enabled=false",
        "weather-refresh.enabled=false",
        "heat-control.config-file=classpath:test-site-config.json"
})
@DisplayName("Tests de Integración - API REST")
class HeatControlIntegrationTest {

    private static final String OWNER = "X-Owner-Id";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IWeatherProvider weatherProvider;

    @Test
    @DisplayName("Health check")
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("Las habitaciones del site-config se cargan por dueño")
    void testRoomsFromConfig() throws Exception {
        mockMvc.perform(get("/api/rooms").header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].name", hasItem("Living")))
                .andExpect(jsonPath("$[*].name", hasItem("Cocina")))
                .andExpect(jsonPath("$[*].id", not(hasItem(10))));

        mockMvc.perform(get("/api/rooms/1/settings").header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timezone").value("Europe/Berlin"))
                .andExpect(jsonPath("$.wanted_temp_day").value(21.0))
                .andExpect(jsonPath("$.night_start").value("22:00"));
    }

    @Test
    @DisplayName("Sin header de dueño la solicitud se rechaza")
    void testMissingOwnerHeader() throws Exception {
        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Crear habitación: 201 con horario por defecto; nombre repetido: 400")
    void testCreateRoom() throws Exception {
        mockMvc.perform(post("/api/rooms").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Estudio\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Estudio"));

        mockMvc.perform(post("/api/rooms").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Estudio\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    @DisplayName("Lectura fría: calefacción encendida; lectura caliente: apagada")
    void testHeatingDecision() throws Exception {
        long roomId = createRoom(1, "Decision");

        mockMvc.perform(get("/api/heating_on/" + roomId).header(OWNER, 1))
                .andExpect(status().isNotFound());

        postTemperature(1, roomId, 5.0);
        mockMvc.perform(get("/api/heating_on/" + roomId).header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room_id").value(roomId))
                .andExpect(jsonPath("$.current_temperature").value(5.0))
                .andExpect(jsonPath("$.heating_on").value(true));

        postTemperature(1, roomId, 30.0);
        mockMvc.perform(get("/api/heating_on/" + roomId).header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_temperature").value(30.0))
                .andExpect(jsonPath("$.heating_on").value(false));

        mockMvc.perform(get("/api/temperature/" + roomId + "/latest").header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(30.0));
    }

    @Test
    @DisplayName("Habitaciones ajenas no son visibles")
    void testOwnershipIsEnforced() throws Exception {
        long roomId = createRoom(1, "Privada");

        mockMvc.perform(get("/api/heating_on/" + roomId).header(OWNER, 2))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/temperature").header(OWNER, 2)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_id\": " + roomId + ", \"temperature\": 20.0}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/rooms/" + roomId).header(OWNER, 2))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Horario: actualizar, leer y rechazar zona desconocida")
    void testSettings() throws Exception {
        long roomId = createRoom(1, "Horario");

        mockMvc.perform(put("/api/rooms/" + roomId + "/settings").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "timezone": "UTC",
                                  "wanted_temp_day": 22.5,
                                  "wanted_temp_night": 17.0,
                                  "night_start": "23:00",
                                  "night_end": "07:30"
                                }
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/rooms/" + roomId + "/settings").header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timezone").value("UTC"))
                .andExpect(jsonPath("$.wanted_temp_day").value(22.5))
                .andExpect(jsonPath("$.night_end").value("07:30"));

        mockMvc.perform(get("/api/rooms/" + roomId + "/target").header(OWNER, 1)
                        .param("at", "2024-01-15T23:30:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.target_temperature").value(17.0));

        mockMvc.perform(put("/api/rooms/" + roomId + "/settings").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "timezone": "Europe/Atlantis",
                                  "wanted_temp_day": 22.5,
                                  "wanted_temp_night": 17.0,
                                  "night_start": "23:00",
                                  "night_end": "07:30"
                                }
                                """))
                .andExpect(status().isBadRequest());

        mockMvc.perform(put("/api/rooms/" + roomId + "/settings").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timezone\": \"UTC\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Zona inválida cargada desde la configuración: 400 al resolver el objetivo")
    void testInvalidZoneFromConfig() throws Exception {
        mockMvc.perform(get("/api/rooms/10/target").header(OWNER, 2))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("Mars/Olympus")));
    }

    @Test
    @DisplayName("Lote con timestamps se consulta por rango; más de 100 valores: 400")
    void testBatchIngestion() throws Exception {
        long roomId = createRoom(1, "Lote");

        mockMvc.perform(post("/api/temperature/batch").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "room_id": %d,
                                  "temperatures": [19.5, 19.8, 20.1],
                                  "timestamps": ["2024-01-15T10:00:00Z", "2024-01-15T10:05:00Z", "2024-01-15T10:10:00Z"]
                                }
                                """.formatted(roomId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.count").value(3));

        mockMvc.perform(get("/api/temperature/" + roomId).header(OWNER, 1)
                        .param("start", "2024-01-15T10:00:00Z")
                        .param("end", "2024-01-15T10:10:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].value").value(19.5))
                .andExpect(jsonPath("$[1].time").value("2024-01-15T10:05:00Z"));

        String tooMany = Collections.nCopies(101, "20.0").stream().collect(Collectors.joining(","));
        mockMvc.perform(post("/api/temperature/batch").header(OWNER, 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_id\": " + roomId + ", \"temperatures\": [" + tooMany + "]}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/temperature/" + roomId).header(OWNER, 1)
                        .param("start", "2024-01-15T00:00:00Z")
                        .param("end", "2024-01-16T00:00:00Z"))
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    @DisplayName("Límites de rango inválidos: 400")
    void testInvalidRange() throws Exception {
        mockMvc.perform(get("/api/temperature/1").header(OWNER, 1).param("start", "ayer"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/temperature/1").header(OWNER, 1)
                        .param("start", "-1h").param("end", "-2h"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/temperatures/all").header(OWNER, 1)
                        .param("start", "now").param("end", "now"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    @DisplayName("Borrar habitación la quita del listado")
    void testDeleteRoom() throws Exception {
        long roomId = createRoom(1, "Temporal");
        postTemperature(1, roomId, 20.0);

        mockMvc.perform(delete("/api/rooms/" + roomId).header(OWNER, 1))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/rooms").header(OWNER, 1))
                .andExpect(jsonPath("$[*].id", not(hasItem((int) roomId))));
        mockMvc.perform(get("/api/temperature/" + roomId + "/latest").header(OWNER, 1))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Clima actual: condición WMO; proveedor caído: 502; sin ubicación: 404")
    void testCurrentWeather() throws Exception {
        when(weatherProvider.fetchCurrent(anyDouble(), anyDouble()))
                .thenReturn(new WeatherObservation(2.5, 3, "2024-01-15T12:00"));

        mockMvc.perform(get("/api/weather").header(OWNER, 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.temperature").value(2.5))
                .andExpect(jsonPath("$.weather_condition").value("Overcast"))
                .andExpect(jsonPath("$.location").value("52.52,13.405"));

        mockMvc.perform(get("/api/weather").header(OWNER, 2))
                .andExpect(status().isNotFound());

        when(weatherProvider.fetchCurrent(anyDouble(), anyDouble()))
                .thenThrow(new ExternalProviderException("HTTP 500"));
        mockMvc.perform(get("/api/weather").header(OWNER, 1))
                .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("Historial de clima vacío sin refresco")
    void testWeatherHistory() throws Exception {
        mockMvc.perform(get("/api/weather_temperature").header(OWNER, 2).param("start", "-7d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    private long createRoom(long ownerId, String name) throws Exception {
        String body = mockMvc.perform(post("/api/rooms").header(OWNER, ownerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"" + name + "\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.parse(body).read("$.id", Long.class);
    }

    private void postTemperature(long ownerId, long roomId, double value) throws Exception {
        mockMvc.perform(post("/api/temperature").header(OWNER, ownerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"room_id\": " + roomId + ", \"temperature\": " + value + "}"))
                .andExpect(status().isCreated());
    }
}
