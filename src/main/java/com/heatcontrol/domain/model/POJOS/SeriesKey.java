package com.heatcontrol.domain.model.POJOS;

import java.util.Objects;

/**
 * Identificador de una serie de muestras.
 * Las temperaturas de habitación se particionan por (dueño, habitación);
 * el clima exterior solo por dueño (roomId es null).
 */
public final class SeriesKey {
    private final SeriesFamily family;
    private final long ownerId;
    private final Long roomId;

    private SeriesKey(SeriesFamily family, long ownerId, Long roomId) {
        this.family = family;
        this.ownerId = ownerId;
        this.roomId = roomId;
    }

    public static SeriesKey room(long ownerId, long roomId) {
        return new SeriesKey(SeriesFamily.ROOM_TEMPERATURE, ownerId, roomId);
    }

    public static SeriesKey weather(long ownerId) {
        return new SeriesKey(SeriesFamily.OUTDOOR_WEATHER, ownerId, null);
    }

    public SeriesFamily getFamily() { return family; }
    public long getOwnerId() { return ownerId; }
    public Long getRoomId() { return roomId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeriesKey that = (SeriesKey) o;
        return ownerId == that.ownerId &&
                family == that.family &&
                Objects.equals(roomId, that.roomId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, ownerId, roomId);
    }

    @Override
    public String toString() {
        return family.getMeasurement() + "{owner=" + ownerId +
                (roomId != null ? ", room=" + roomId : "") + "}";
    }
}
