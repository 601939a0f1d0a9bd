package com.heatcontrol.infrastructure.config;

import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.service.HeatControlService;
import com.heatcontrol.infrastructure.mqtt.MqttTemperatureSubscriber;
import com.heatcontrol.infrastructure.repository.IRoomRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuración para el cliente MQTT.
 * Suscribe los tópicos de sensor de las habitaciones cargadas desde el site-config.json.
 * Solo se activa si mqtt.enabled=true.
 */
@Configuration
public class MqttConfig {

    @Bean
    @ConditionalOnProperty(name = "mqtt.enabled", havingValue = "true")
    public MqttTemperatureSubscriber mqttTemperatureSubscriber(
            HeatControlService heatControlService,
            IRoomRepository roomRepository,
            @Value("${mqtt.broker:tcp://localhost:1883}") String brokerUrl,
            @Value("${mqtt.client-id:heat-control}") String clientId,
            @Value("${mqtt.auto-reconnect:true}") boolean autoReconnect) {

        // tópico -> habitación, solo para habitaciones con sensor configurado
        Map<String, Room> roomsByTopic = new LinkedHashMap<>();
        for (Room room : roomRepository.findAll()) {
            if (room.getSensorTopic() != null && !room.getSensorTopic().isBlank()) {
                roomsByTopic.put(room.getSensorTopic(), room);
            }
        }

        return new MqttTemperatureSubscriber(heatControlService, roomsByTopic, brokerUrl, clientId, autoReconnect);
    }
}
