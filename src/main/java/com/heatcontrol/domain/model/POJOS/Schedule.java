package com.heatcontrol.domain.model.POJOS;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Horario de una habitación: temperatura deseada de día y de noche, y los
 * límites de la ventana nocturna en hora de pared (sin fecha).
 *
 * Si nightStart >= nightEnd la ventana cruza la medianoche (ej: 22:00 → 06:00).
 */
public class Schedule {

    public static final String DEFAULT_TIMEZONE = "Europe/Berlin";
    public static final double DEFAULT_TARGET_DAY = 21.0;
    public static final double DEFAULT_TARGET_NIGHT = 18.0;
    public static final LocalTime DEFAULT_NIGHT_START = LocalTime.of(22, 0);
    public static final LocalTime DEFAULT_NIGHT_END = LocalTime.of(6, 0);

    private final String timezone;
    private final double targetDay;
    private final double targetNight;
    private final LocalTime nightStart;
    private final LocalTime nightEnd;

    public Schedule(String timezone, double targetDay, double targetNight,
                    LocalTime nightStart, LocalTime nightEnd) {
        this.timezone = Objects.requireNonNull(timezone, "timezone");
        this.targetDay = targetDay;
        this.targetNight = targetNight;
        this.nightStart = Objects.requireNonNull(nightStart, "nightStart");
        this.nightEnd = Objects.requireNonNull(nightEnd, "nightEnd");
    }

    /**
     * Horario que se crea automáticamente junto con cada habitación nueva.
     */
    public static Schedule defaults() {
        return new Schedule(DEFAULT_TIMEZONE, DEFAULT_TARGET_DAY, DEFAULT_TARGET_NIGHT,
                DEFAULT_NIGHT_START, DEFAULT_NIGHT_END);
    }

    /**
     * Indica si una hora del día cae dentro de la ventana nocturna.
     * El límite es cerrado en nightStart y abierto en nightEnd (nightEnd ya es día).
     * Con nightStart == nightEnd se aplica la rama de cruce de medianoche, es decir, siempre noche.
     */
    public boolean isNight(LocalTime timeOfDay) {
        if (nightStart.isBefore(nightEnd)) {
            return !timeOfDay.isBefore(nightStart) && timeOfDay.isBefore(nightEnd);
        }
        return !timeOfDay.isBefore(nightStart) || timeOfDay.isBefore(nightEnd);
    }

    public boolean wrapsMidnight() {
        return !nightStart.isBefore(nightEnd);
    }

    // Getters
    public String getTimezone() { return timezone; }
    public double getTargetDay() { return targetDay; }
    public double getTargetNight() { return targetNight; }
    public LocalTime getNightStart() { return nightStart; }
    public LocalTime getNightEnd() { return nightEnd; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schedule schedule = (Schedule) o;
        return Double.compare(schedule.targetDay, targetDay) == 0 &&
                Double.compare(schedule.targetNight, targetNight) == 0 &&
                timezone.equals(schedule.timezone) &&
                nightStart.equals(schedule.nightStart) &&
                nightEnd.equals(schedule.nightEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timezone, targetDay, targetNight, nightStart, nightEnd);
    }

    @Override
    public String toString() {
        return "Schedule{" +
                "timezone='" + timezone + '\'' +
                ", targetDay=" + targetDay +
                ", targetNight=" + targetNight +
                ", nightStart=" + nightStart +
                ", nightEnd=" + nightEnd +
                '}';
    }
}
