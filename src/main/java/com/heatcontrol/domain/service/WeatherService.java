package com.heatcontrol.domain.service;

import com.heatcontrol.domain.model.Logica.IWeatherProvider;
import com.heatcontrol.domain.model.Logica.WeatherCodes;
import com.heatcontrol.domain.model.POJOS.Location;
import com.heatcontrol.domain.model.POJOS.Sample;
import com.heatcontrol.domain.model.POJOS.SeriesKey;
import com.heatcontrol.domain.model.POJOS.WeatherObservation;
import com.heatcontrol.domain.model.api.dto.WeatherResponse;
import com.heatcontrol.domain.model.exception.NotFoundException;
import com.heatcontrol.infrastructure.repository.ILocationDirectory;
import com.heatcontrol.infrastructure.telemetry.TelemetryStoreAdapter;
import com.heatcontrol.infrastructure.telemetry.TimeBound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Clima exterior por dueño: consulta al proveedor y serie histórica.
 */
@Service
public class WeatherService {

    private static final Logger logger = LoggerFactory.getLogger(WeatherService.class);

    private final IWeatherProvider weatherProvider;
    private final ILocationDirectory locationDirectory;
    private final TelemetryStoreAdapter telemetryStore;
    private final Clock clock;

    public WeatherService(
            IWeatherProvider weatherProvider,
            ILocationDirectory locationDirectory,
            TelemetryStoreAdapter telemetryStore,
            Clock clock) {
        this.weatherProvider = weatherProvider;
        this.locationDirectory = locationDirectory;
        this.telemetryStore = telemetryStore;
        this.clock = clock;
    }

    /**
     * Consulta el clima de una ubicación y lo agrega a la serie del dueño con la hora actual.
     * Las fallas del proveedor o del almacén se propagan; quien itera decide cómo aislarlas.
     */
    public Sample recordCurrentWeather(Location location) {
        WeatherObservation observation = weatherProvider.fetchCurrent(location.getLatitude(), location.getLongitude());
        Sample sample = telemetryStore.append(
                SeriesKey.weather(location.getOwnerId()),
                observation.getTemperature(),
                clock.instant());
        logger.debug("Clima guardado para dueño {}: {}°C", location.getOwnerId(), observation.getTemperature());
        return sample;
    }

    /**
     * Clima actual en la ubicación del dueño, sin guardarlo.
     */
    public WeatherResponse currentWeather(long ownerId) {
        Location location = locationDirectory.findLocation(ownerId)
                .orElseThrow(() -> new NotFoundException("No hay ubicación registrada para el dueño " + ownerId));

        WeatherObservation observation = weatherProvider.fetchCurrent(location.getLatitude(), location.getLongitude());

        return WeatherResponse.builder()
                .temperature(observation.getTemperature())
                .weatherCondition(WeatherCodes.describe(observation.getWeatherCode()))
                .location(String.format(Locale.US, "%s,%s", location.getLatitude(), location.getLongitude()))
                .timestamp(observation.getObservedAt() != null ? observation.getObservedAt() : clock.instant().toString())
                .build();
    }

    public List<Sample> weatherHistory(long ownerId, TimeBound start, TimeBound end) {
        return telemetryStore.range(SeriesKey.weather(ownerId), start, end);
    }
}
