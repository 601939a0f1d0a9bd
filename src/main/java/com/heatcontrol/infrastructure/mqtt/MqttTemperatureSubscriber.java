package com.heatcontrol.infrastructure.mqtt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.service.HeatControlService;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cliente MQTT que se suscribe a los tópicos de sensor de las habitaciones
 * y agrega cada lectura a la serie de temperatura de la habitación correspondiente.
 * Los mensajes que no se pueden interpretar se registran y se descartan.
 */
public class MqttTemperatureSubscriber implements MqttCallback {

    private static final Logger logger = LoggerFactory.getLogger(MqttTemperatureSubscriber.class);

    private final HeatControlService heatControlService;
    private final Map<String, Room> roomsByTopic;
    private final String brokerUrl;
    private final String clientId;
    private final boolean autoReconnect;
    private MqttClient mqttClient;
    private MqttConnectOptions connectOptions;
    private final Object clientLock = new Object();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final ObjectMapper objectMapper = new ObjectMapper();

    public MqttTemperatureSubscriber(
            HeatControlService heatControlService,
            Map<String, Room> roomsByTopic,
            String brokerUrl,
            String clientId,
            boolean autoReconnect) {
        this.heatControlService = heatControlService;
        this.roomsByTopic = roomsByTopic != null ? Map.copyOf(roomsByTopic) : Map.of();
        this.brokerUrl = brokerUrl;
        this.clientId = clientId;
        this.autoReconnect = autoReconnect;
    }

    @PostConstruct
    public void init() {
        try {
            connectOptions = buildConnectOptions();
            connectClient(true);
            logger.info("Cliente MQTT conectado al broker: {}", brokerUrl);
        } catch (MqttException e) {
            // La aplicación sigue sin MQTT; la API REST sigue aceptando lecturas
            logger.warn("No se pudo conectar con el broker MQTT {}: {}", brokerUrl, e.getMessage());
        }
    }

    @PreDestroy
    public void destroy() {
        synchronized (clientLock) {
            reconnecting.set(false);
            if (mqttClient != null && mqttClient.isConnected()) {
                try {
                    mqttClient.disconnect();
                    mqttClient.close();
                    logger.info("Cliente MQTT desconectado");
                } catch (MqttException e) {
                    logger.error("Error al desconectar cliente MQTT: {}", e.getMessage(), e);
                }
            }
        }
    }

    public boolean isConnected() {
        synchronized (clientLock) {
            return mqttClient != null && mqttClient.isConnected();
        }
    }

    private MqttConnectOptions buildConnectOptions() {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setAutomaticReconnect(autoReconnect);
        options.setCleanSession(true);
        options.setConnectionTimeout(30);
        options.setKeepAliveInterval(60);
        return options;
    }

    private void connectClient(boolean forceNewClient) throws MqttException {
        synchronized (clientLock) {
            if (forceNewClient || mqttClient == null) {
                if (mqttClient != null) {
                    try {
                        mqttClient.close();
                    } catch (MqttException e) {
                        logger.debug("Error al cerrar el cliente MQTT previo: {}", e.getMessage());
                    }
                }
                String uniqueClientId = clientId + "-" + System.currentTimeMillis();
                mqttClient = new MqttClient(brokerUrl, uniqueClientId, new MemoryPersistence());
                mqttClient.setCallback(this);
            }

            if (connectOptions == null) {
                connectOptions = buildConnectOptions();
            }

            if (!mqttClient.isConnected()) {
                mqttClient.connect(connectOptions);
                subscribeToTopics();
            }
        }
    }

    private void subscribeToTopics() throws MqttException {
        if (roomsByTopic.isEmpty()) {
            logger.warn("No hay habitaciones con tópico de sensor configurado");
            return;
        }
        for (String topic : roomsByTopic.keySet()) {
            mqttClient.subscribe(topic, 1); // QoS 1
            logger.info("Suscrito al tópico: {}", topic);
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        logger.warn("Conexión MQTT perdida: {}", cause.getMessage());

        if (autoReconnect) {
            logger.info("Intentando reconectar...");
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!reconnecting.compareAndSet(false, true)) {
            return;
        }

        Thread reconnectionThread = new Thread(() -> {
            while (reconnecting.get()) {
                try {
                    connectClient(true);
                    logger.info("Reconexión MQTT exitosa al broker: {}", brokerUrl);
                    reconnecting.set(false);
                } catch (MqttException e) {
                    logger.warn("Reintento de conexión MQTT fallido: {}. Nuevo intento en 5s...", e.getMessage());
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException interruptedException) {
                        Thread.currentThread().interrupt();
                        reconnecting.set(false);
                    }
                }
            }
        }, "mqtt-reconnector");

        reconnectionThread.setDaemon(true);
        reconnectionThread.start();
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        handleMessage(topic, message.getPayload());
    }

    /**
     * Procesa un payload recibido en un tópico. Nunca lanza excepciones.
     *
     * @return la muestra registrada, o null si el mensaje se descartó
     */
    public Sample handleMessage(String topic, byte[] payload) {
        Room room = roomsByTopic.get(topic);
        if (room == null) {
            logger.warn("Mensaje en tópico sin habitación asociada: {}", topic);
            return null;
        }

        try {
            String text = new String(payload, StandardCharsets.UTF_8);
            logger.debug("Mensaje recibido del tópico: {} - {}", topic, text);

            JsonNode jsonNode = objectMapper.readTree(text);
            double temperature = extractTemperature(jsonNode);
            Instant timestamp = extractTimestamp(jsonNode);

            Sample sample = timestamp != null
                    ? heatControlService.recordTemperature(room.getOwnerId(), room.getId(), temperature, timestamp)
                    : heatControlService.recordTemperature(room.getOwnerId(), room.getId(), temperature);

            logger.info("Lectura MQTT registrada - Habitación: {}, Temperatura: {}", room.getId(), temperature);
            return sample;
        } catch (Exception e) {
            logger.error("Error al procesar mensaje MQTT del tópico {}: {}", topic, e.getMessage());
            return null;
        }
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // Solo se suscribe, no publica
    }

    /**
     * Extrae la temperatura del JSON.
     */
    private double extractTemperature(JsonNode jsonNode) {
        for (String field : new String[]{"temperature", "temp", "value"}) {
            JsonNode node = jsonNode.get(field);
            if (node != null && node.isNumber()) {
                return node.asDouble();
            }
        }
        // Mensajes Shelly: params -> "temperature:0" -> tC
        JsonNode paramsNode = jsonNode.get("params");
        if (paramsNode != null) {
            JsonNode shellyTemp = paramsNode.get("temperature:0");
            if (shellyTemp != null && shellyTemp.has("tC")) {
                return shellyTemp.get("tC").asDouble();
            }
            JsonNode tempNode = paramsNode.get("temperature");
            if (tempNode != null && tempNode.has("tC")) {
                return tempNode.get("tC").asDouble();
            }
        }
        throw new IllegalArgumentException("No se encontró campo de temperatura en el mensaje");
    }

    /**
     * Extrae el timestamp del JSON, o null si no viene.
     */
    private Instant extractTimestamp(JsonNode jsonNode) {
        for (String field : new String[]{"time_stamp", "timestamp", "time"}) {
            if (jsonNode.hasNonNull(field)) {
                return TimeBound.parseInstant(jsonNode.get(field).asText());
            }
        }
        // Mensajes Shelly: segundos epoch (double) en params.ts o ts
        JsonNode paramsNode = jsonNode.get("params");
        if (paramsNode != null && paramsNode.has("ts")) {
            return Instant.ofEpochMilli((long) (paramsNode.get("ts").asDouble() * 1000));
        }
        if (jsonNode.has("ts")) {
            return Instant.ofEpochMilli((long) (jsonNode.get("ts").asDouble() * 1000));
        }
        return null;
    }
}
