package com.heatcontrol.infrastructure.repository;

import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Schedule;
import com.heatcontrol.domain.model.exception.InvalidArgumentException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Habitaciones y horarios en memoria.
 * Las altas y bajas se serializan para mantener único el nombre por dueño;
 * las lecturas no toman lock.
 */
public class InMemoryRoomRepository implements IRoomRepository {

    private final Map<Long, Room> roomsById = new ConcurrentHashMap<>();
    private final Map<Long, Schedule> schedulesByRoomId = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Object writeLock = new Object();

    @Override
    public Optional<Room> findRoom(long ownerId, long roomId) {
        Room room = roomsById.get(roomId);
        if (room == null || room.getOwnerId() != ownerId) {
            return Optional.empty();
        }
        return Optional.of(room);
    }

    @Override
    public boolean roomBelongsTo(long ownerId, long roomId) {
        return findRoom(ownerId, roomId).isPresent();
    }

    @Override
    public Optional<Schedule> getSchedule(long ownerId, long roomId) {
        return findRoom(ownerId, roomId).map(room -> schedulesByRoomId.get(room.getId()));
    }

    @Override
    public List<Room> findRooms(long ownerId) {
        return roomsById.values().stream()
                .filter(room -> room.getOwnerId() == ownerId)
                .sorted(Comparator.comparingLong(Room::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<Room> findAll() {
        return roomsById.values().stream()
                .sorted(Comparator.comparingLong(Room::getId))
                .collect(Collectors.toList());
    }

    @Override
    public Room createRoom(long ownerId, String name) {
        synchronized (writeLock) {
            ensureUniqueName(ownerId, name);
            Room room = new Room(nextId.getAndIncrement(), ownerId, name);
            roomsById.put(room.getId(), room);
            schedulesByRoomId.put(room.getId(), Schedule.defaults());
            return room;
        }
    }

    @Override
    public Room addRoom(Room room, Schedule schedule) {
        synchronized (writeLock) {
            if (roomsById.containsKey(room.getId())) {
                throw new InvalidArgumentException("Ya existe una habitación con id " + room.getId());
            }
            ensureUniqueName(room.getOwnerId(), room.getName());
            roomsById.put(room.getId(), room);
            schedulesByRoomId.put(room.getId(), schedule != null ? schedule : Schedule.defaults());
            // Los ids generados siempre quedan por encima de los cargados
            nextId.accumulateAndGet(room.getId() + 1, Math::max);
            return room;
        }
    }

    @Override
    public boolean updateSchedule(long ownerId, long roomId, Schedule schedule) {
        synchronized (writeLock) {
            if (!roomBelongsTo(ownerId, roomId)) {
                return false;
            }
            schedulesByRoomId.put(roomId, schedule);
            return true;
        }
    }

    @Override
    public boolean deleteRoom(long ownerId, long roomId) {
        synchronized (writeLock) {
            if (!roomBelongsTo(ownerId, roomId)) {
                return false;
            }
            roomsById.remove(roomId);
            schedulesByRoomId.remove(roomId);
            return true;
        }
    }

    private void ensureUniqueName(long ownerId, String name) {
        boolean exists = roomsById.values().stream()
                .anyMatch(r -> r.getOwnerId() == ownerId && r.getName().equals(name));
        if (exists) {
            throw new InvalidArgumentException("El dueño " + ownerId + " ya tiene una habitación llamada '" + name + "'");
        }
    }
}
