package com.heatcontrol.unit.infrastructure;

import com.heatcontrol.domain.model.Controllers.HeatingDecisionEngine;
import com.heatcontrol.domain.model.Controllers.TargetResolver;
import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.Schedule;
import com.heatcontrol.domain.service.BatchIngestionService;
import com.heatcontrol.domain.service.HeatControlService;
import com.heatcontrol.infrastructure.mqtt.MqttTemperatureSubscriber;
import com.heatcontrol.infrastructure.repository.InMemoryRoomRepository;
import com.heatcontrol.infrastructure.telemetry.InMemoryTelemetryStore;
import com.heatcontrol.infrastructure.telemetry.TelemetryStoreAdapter;
import com.heatcontrol.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MqttTemperatureSubscriber - Interpretación de mensajes")
class MqttTemperatureSubscriberTest {

    private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
    private static final String TOPIC = "home/living/temperature";

    private HeatControlService service;
    private MqttTemperatureSubscriber subscriber;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        InMemoryRoomRepository rooms = new InMemoryRoomRepository();
        Room living = rooms.addRoom(new Room(1, 1, "Living", TOPIC), Schedule.defaults());
        TelemetryStoreAdapter telemetryStore = new TelemetryStoreAdapter(new InMemoryTelemetryStore(), clock, 24);
        service = new HeatControlService(rooms, telemetryStore, new HeatingDecisionEngine(new TargetResolver()),
                new BatchIngestionService(telemetryStore, clock, 100), clock, 7);
        // No se conecta: solo se prueba el procesamiento de payloads
        subscriber = new MqttTemperatureSubscriber(service, Map.of(TOPIC, living), "tcp://localhost:1", "test", false);
    }

    @Test
    @DisplayName("Mensaje con temperature y timestamp ISO")
    void shouldRecordSimpleMessage() {
        Sample sample = subscriber.handleMessage(TOPIC, bytes("{\"temperature\": 19.5, \"timestamp\": \"2024-01-15T11:59:00Z\"}"));

        assertThat(sample).isNotNull();
        assertThat(sample.getValue()).isEqualTo(19.5);
        assertThat(sample.getTimestamp()).isEqualTo(Instant.parse("2024-01-15T11:59:00Z"));
        assertThat(service.latestTemperature(1, 1)).isEqualTo(sample);
    }

    @Test
    @DisplayName("Mensaje sin timestamp usa la hora actual")
    void shouldStampWithNow() {
        Sample sample = subscriber.handleMessage(TOPIC, bytes("{\"temp\": 20.1}"));

        assertThat(sample.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Mensaje Shelly con params.temperature:0.tC y ts en segundos")
    void shouldRecordShellyMessage() {
        String payload = """
                {
                  "src": "shellyht-01",
                  "method": "NotifyStatus",
                  "params": {
                    "ts": 1705319940.25,
                    "temperature:0": { "id": 0, "tC": 18.3, "tF": 64.9 }
                  }
                }
                """;

        Sample sample = subscriber.handleMessage(TOPIC, bytes(payload));

        assertThat(sample.getValue()).isEqualTo(18.3);
        assertThat(sample.getTimestamp()).isEqualTo(Instant.ofEpochMilli(1705319940250L));
    }

    @Test
    @DisplayName("Mensajes mal formados o de tópicos desconocidos se descartan sin lanzar")
    void shouldDropMalformedMessages() {
        assertThat(subscriber.handleMessage(TOPIC, bytes("no es json"))).isNull();
        assertThat(subscriber.handleMessage(TOPIC, bytes("{\"humidity\": 40}"))).isNull();
        assertThat(subscriber.handleMessage(TOPIC, bytes("{\"temperature\": 19, \"timestamp\": \"ayer\"}"))).isNull();
        assertThat(subscriber.handleMessage("otro/topico", bytes("{\"temperature\": 19}"))).isNull();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
