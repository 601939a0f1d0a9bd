package com.heatcontrol.infrastructure.scheduler;

import com.heatcontrol.domain.model.POJOS.Location;
import com.heatcontrol.domain.service.WeatherService;
import com.heatcontrol.infrastructure.repository.ILocationDirectory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monitor que refresca periódicamente el clima exterior de cada ubicación registrada
 * y lo guarda en la serie de clima del dueño.
 *
 * Cada ciclo recorre todas las ubicaciones; una falla en una ubicación (proveedor o almacén)
 * se registra y se continúa con la siguiente. Si no se puede obtener la lista de ubicaciones
 * el ciclo entero se aborta y se reintenta en el próximo intervalo.
 *
 * Usa un thread manual. Se puede deshabilitar configurando: weather-refresh.enabled=false
 */
@Component
@ConditionalOnProperty(name = "weather-refresh.enabled", havingValue = "true", matchIfMissing = true)
public class WeatherRefreshMonitor {

    private static final Logger logger = LoggerFactory.getLogger(WeatherRefreshMonitor.class);

    private final ILocationDirectory locationDirectory;
    private final WeatherService weatherService;

    private Thread monitorThread;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long refreshIntervalMs;

    public WeatherRefreshMonitor(
            ILocationDirectory locationDirectory,
            WeatherService weatherService,
            @Value("${weather-refresh.interval-seconds:600}") long refreshIntervalSeconds) {
        this.locationDirectory = locationDirectory;
        this.weatherService = weatherService;
        this.refreshIntervalMs = refreshIntervalSeconds * 1000;
    }

    /**
     * Inicia el thread de refresco cuando el componente se crea.
     */
    @PostConstruct
    public void init() {
        running.set(true);
        monitorThread = new Thread(this::refreshLoop, "WeatherRefreshMonitor-Thread");
        monitorThread.setDaemon(true);
        monitorThread.start();
        logger.info("Monitor de clima iniciado (thread manual) - Intervalo de refresco: {} segundos", refreshIntervalMs / 1000);
    }

    /**
     * Detiene el thread de refresco cuando el componente se destruye.
     */
    @PreDestroy
    public void destroy() {
        running.set(false);
        if (monitorThread != null) {
            monitorThread.interrupt();
            try {
                monitorThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrumpido mientras esperaba que el thread de clima termine");
            }
            logger.info("Monitor de clima detenido");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Ejecuta un ciclo y duerme el intervalo configurado, verificando running cada segundo.
     * El primer ciclo corre apenas arranca el thread.
     */
    private void refreshLoop() {
        logger.debug("Thread de refresco de clima iniciado");

        while (running.get()) {
            try {
                refreshCycle();

                long sleepTime = refreshIntervalMs;
                long startTime = System.currentTimeMillis();
                while (running.get() && sleepTime > 0) {
                    Thread.sleep(Math.min(sleepTime, 1000));
                    sleepTime = refreshIntervalMs - (System.currentTimeMillis() - startTime);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.debug("Thread de refresco de clima interrumpido");
                break;
            } catch (Throwable t) {
                // Último recurso: el thread sigue vivo aunque un ciclo termine con un Error
                logger.error("Error en el thread de refresco de clima: {}", t.getMessage(), t);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        logger.debug("Thread de refresco de clima finalizado");
    }

    /**
     * Un ciclo de refresco: consulta el clima de cada ubicación y lo guarda con la hora actual.
     * Nunca lanza excepciones; solo propaga errores de la JVM (OutOfMemoryError, StackOverflowError).
     *
     * @return cantidad de muestras guardadas en este ciclo
     */
    public int refreshCycle() {
        List<Location> locations;
        try {
            locations = locationDirectory.listLocations();
        } catch (Exception e) {
            logger.error("No se pudo obtener la lista de ubicaciones, se aborta el ciclo: {}", e.getMessage(), e);
            return 0;
        }

        int stored = 0;
        for (Location location : locations) {
            try {
                weatherService.recordCurrentWeather(location);
                stored++;
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Exception | Error e) {
                // Errores de carga de clases o de inicialización solo afectan a esta ubicación
                logger.warn("No se pudo refrescar el clima del dueño {}: {}", location.getOwnerId(), e.toString());
            }
        }

        logger.info("Ciclo de clima completado: {}/{} ubicaciones actualizadas", stored, locations.size());
        return stored;
    }
}
