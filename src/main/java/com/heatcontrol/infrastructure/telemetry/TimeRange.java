package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.exception.InvalidArgumentException;

import java.time.Duration;
import java.time.Instant;

/**
 * Rango semiabierto [start, end) ya resuelto a instantes absolutos.
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    private TimeRange(Instant start, Instant end) {
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(Instant start, Instant end) {
        if (start.isAfter(end)) {
            throw new InvalidArgumentException("El inicio del rango (" + start + ") es posterior al fin (" + end + ")");
        }
        return new TimeRange(start, end);
    }

    /**
     * Resuelve los límites contra "ahora".
     * Sin fin se usa "ahora"; sin inicio se usa {@code defaultWindow} antes del fin.
     */
    public static TimeRange resolve(TimeBound start, TimeBound end, Instant now, Duration defaultWindow) {
        Instant resolvedEnd = end != null ? end.resolve(now) : now;
        Instant resolvedStart = start != null ? start.resolve(now) : resolvedEnd.minus(defaultWindow);
        return of(resolvedStart, resolvedEnd);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
