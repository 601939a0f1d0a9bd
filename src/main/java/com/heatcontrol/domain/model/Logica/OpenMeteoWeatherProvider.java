package com.heatcontrol.domain.model.Logica;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heatcontrol.domain.model.POJOS.WeatherObservation;
import com.heatcontrol.domain.model.exception.ExternalProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * Cliente HTTP de Open-Meteo.
 * GET {baseUrl}?latitude=..&longitude=..&current=temperature_2m,weather_code&timezone=auto
 * y lee { "current": { "temperature_2m": 4.2, "weather_code": 3, "time": "..." } }.
 */
public class OpenMeteoWeatherProvider implements IWeatherProvider {
    private static final Logger logger = LoggerFactory.getLogger(OpenMeteoWeatherProvider.class);

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OpenMeteoWeatherProvider(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    // Permite inyectar el cliente en tests
    public OpenMeteoWeatherProvider(String baseUrl, Duration timeout, HttpClient http) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.http = http;
    }

    @Override
    public WeatherObservation fetchCurrent(double latitude, double longitude) {
        URI uri = buildUri(latitude, longitude);
        logger.debug("Consultando clima actual: {}", uri);

        HttpRequest req = HttpRequest.newBuilder(uri)
                .GET().timeout(timeout).header("Accept", "application/json").build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalProviderException("Error de red al consultar el clima en " + latitude + "," + longitude + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException("Interrupción al consultar el clima en " + latitude + "," + longitude, e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            logger.warn("Error HTTP {} del proveedor de clima para {},{}", resp.statusCode(), latitude, longitude);
            throw new ExternalProviderException("Error HTTP " + resp.statusCode() + " del proveedor de clima");
        }

        return parse(resp.body());
    }

    /**
     * Extrae temperatura y código de clima de la respuesta.
     * Sin "current.temperature_2m" numérico la respuesta se considera inválida.
     */
    public WeatherObservation parse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalProviderException("Respuesta del proveedor de clima mal formada: " + e.getOriginalMessage(), e);
        }

        JsonNode current = root == null ? null : root.get("current");
        if (current == null || !current.isObject()) {
            throw new ExternalProviderException("La respuesta del proveedor de clima no tiene campo 'current'");
        }
        JsonNode temperature = current.get("temperature_2m");
        if (temperature == null || !temperature.isNumber()) {
            throw new ExternalProviderException("La respuesta del proveedor de clima no tiene 'current.temperature_2m'");
        }

        int weatherCode = current.path("weather_code").asInt(0);
        String time = current.hasNonNull("time") ? current.get("time").asText() : null;
        return new WeatherObservation(temperature.asDouble(), weatherCode, time);
    }

    private URI buildUri(double latitude, double longitude) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + "latitude=" + String.format(Locale.US, "%.6f", latitude)
                + "&longitude=" + String.format(Locale.US, "%.6f", longitude)
                + "&current=temperature_2m,weather_code"
                + "&timezone=auto");
    }
}
