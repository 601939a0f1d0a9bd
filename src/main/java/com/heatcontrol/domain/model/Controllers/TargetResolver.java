package com.heatcontrol.domain.model.Controllers;

import com.heatcontrol.domain.model.POJOS.Schedule;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Convierte un horario día/noche y un instante en la temperatura objetivo.
 *
 * IMPORTANTE: no consulta el reloj. El instante llega siempre como parámetro
 * desde la capa de servicio.
 *
 * Una zona horaria mal configurada hace fallar ZoneId.of con DateTimeException;
 * es un error de configuración que resuelve quien llama.
 */
public class TargetResolver {

    /**
     * Temperatura objetivo para el instante dado, evaluado en la zona horaria del horario.
     */
    public double resolveTarget(Schedule schedule, Instant now) {
        return resolveTarget(schedule, now.atZone(ZoneId.of(schedule.getTimezone())));
    }

    /**
     * Igual que {@link #resolveTarget(Schedule, Instant)} pero recibiendo un instante con zona.
     * La hora de pared se toma siempre en la zona del horario, no en la de {@code now}.
     */
    public double resolveTarget(Schedule schedule, ZonedDateTime now) {
        return isNight(schedule, now) ? schedule.getTargetNight() : schedule.getTargetDay();
    }

    public boolean isNight(Schedule schedule, ZonedDateTime now) {
        LocalTime timeOfDay = now.withZoneSameInstant(ZoneId.of(schedule.getTimezone())).toLocalTime();
        return schedule.isNight(timeOfDay);
    }
}
