package com.heatcontrol.infrastructure.telemetry;

import com.heatcontrol.domain.model.exception.InvalidArgumentException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Límite de un rango de consulta: instante absoluto o duración relativa a "ahora".
 *
 * Formatos aceptados en {@link #parse(String)}:
 * - "now"
 * - relativo: "-30s", "-15m", "-24h", "-7d", "-2w"
 * - absoluto: ISO-8601 con zona ("2026-01-01T00:00:00Z", "2026-01-01T01:00:00+01:00")
 *   o fecha-hora local ("2026-01-01T00:00:00", "2026-01-01 00:00:00"), que se interpreta en UTC
 * - solo fecha ("2026-01-01"): inicio del día en UTC
 */
public final class TimeBound {

    private static final Pattern RELATIVE = Pattern.compile("^-(\\d{1,9})([smhdw])$");

    // fecha, y opcionalmente "T" + hora + zona
    private static final DateTimeFormatter ISO_DATE_OPTIONAL_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .parseLenient()
            .appendOffsetId()
            .parseStrict()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private final Instant absolute;
    private final Duration offset;

    private TimeBound(Instant absolute, Duration offset) {
        this.absolute = absolute;
        this.offset = offset;
    }

    public static TimeBound at(Instant instant) {
        return new TimeBound(Objects.requireNonNull(instant, "instant"), null);
    }

    /**
     * Límite relativo: "hace {@code ago}" respecto del instante en que se resuelve.
     */
    public static TimeBound ago(Duration ago) {
        if (ago.isNegative()) {
            throw new InvalidArgumentException("La duración relativa no puede ser negativa: " + ago);
        }
        return new TimeBound(null, ago);
    }

    public static TimeBound now() {
        return new TimeBound(null, Duration.ZERO);
    }

    /**
     * Parsea un token de límite. Devuelve null si el token es null o vacío,
     * para que el llamador aplique el valor por defecto.
     */
    public static TimeBound parse(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        String trimmed = token.trim();

        if (trimmed.equalsIgnoreCase("now") || trimmed.equalsIgnoreCase("now()")) {
            return now();
        }

        Matcher matcher = RELATIVE.matcher(trimmed);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return ago(toDuration(amount, matcher.group(2)));
        }

        return at(parseInstant(trimmed));
    }

    /**
     * Parsea un instante ISO-8601. Acepta:
     * - fecha y hora con zona ("2024-01-10T08:00:00+01:00", "2024-01-10T08:00:00Z")
     * - fecha y hora sin zona, separadas por "T" o por un espacio ("2024-01-10 08:00:00"), en UTC
     * - solo fecha ("2024-01-10"), que se toma como el inicio del día en UTC
     */
    public static Instant parseInstant(String text) {
        String normalized = text.trim();
        if (normalized.endsWith("Z") || normalized.endsWith("z")) {
            normalized = normalized.substring(0, normalized.length() - 1) + "+00:00";
        }
        // "yyyy-MM-dd HH:mm..." -> "yyyy-MM-ddTHH:mm..."
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + "T" + normalized.substring(11).trim();
        }
        try {
            TemporalAccessor parsed = ISO_DATE_OPTIONAL_TIME.parse(normalized);
            LocalDate date = parsed.query(TemporalQueries.localDate());
            LocalTime time = parsed.query(TemporalQueries.localTime());
            ZoneOffset offset = parsed.query(TemporalQueries.offset());
            return OffsetDateTime.of(
                    date,
                    time != null ? time : LocalTime.MIDNIGHT,
                    offset != null ? offset : ZoneOffset.UTC).toInstant();
        } catch (DateTimeException e) {
            throw new InvalidArgumentException("Formato de tiempo inválido: " + text, e);
        }
    }

    private static Duration toDuration(long amount, String unit) {
        switch (unit) {
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            case "w":
                return Duration.ofDays(amount * 7);
            default:
                throw new InvalidArgumentException("Unidad de tiempo desconocida: " + unit);
        }
    }

    public Instant resolve(Instant now) {
        return absolute != null ? absolute : now.minus(offset);
    }

    public boolean isRelative() {
        return absolute == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimeBound that = (TimeBound) o;
        return Objects.equals(absolute, that.absolute) && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(absolute, offset);
    }

    @Override
    public String toString() {
        return absolute != null ? absolute.toString() : "now-" + offset;
    }
}
