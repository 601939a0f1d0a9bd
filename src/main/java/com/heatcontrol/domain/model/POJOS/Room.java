package com.heatcontrol.domain.model.POJOS;

public class Room {
    private final long id;
    private final long ownerId;
    private final String name;
    private final String sensorTopic; // opcional, solo para ingesta MQTT

    // Constructor simplificado para habitaciones creadas por API
    public Room(long id, long ownerId, String name) {
        this(id, ownerId, name, null);
    }

    public Room(long id, long ownerId, String name, String sensorTopic) {
        this.id = id;
        this.ownerId = ownerId;
        this.name = name;
        this.sensorTopic = sensorTopic;
    }

    public SeriesKey seriesKey() {
        return SeriesKey.room(ownerId, id);
    }

    // Getters
    public long getId() { return id; }
    public long getOwnerId() { return ownerId; }
    public String getName() { return name; }
    public String getSensorTopic() { return sensorTopic; }

    @Override
    public String toString() {
        return "Room{" +
                "id=" + id +
                ", ownerId=" + ownerId +
                ", name='" + name + '\'' +
                '}';
    }
}
