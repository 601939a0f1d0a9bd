package com.heatcontrol.infrastructure.repository;

import com.heatcontrol.domain.model.POJOS.Room;
import com.heatcontrol.domain.model.POJOS.Schedule;

import java.util.List;
import java.util.Optional;

/**
 * Almacén de habitaciones y sus horarios.
 * Cada habitación tiene exactamente un horario, creado y borrado junto con ella.
 */
public interface IRoomRepository {

    Optional<Room> findRoom(long ownerId, long roomId);

    boolean roomBelongsTo(long ownerId, long roomId);

    Optional<Schedule> getSchedule(long ownerId, long roomId);

    List<Room> findRooms(long ownerId);

    List<Room> findAll();

    /**
     * Crea una habitación con el horario por defecto.
     */
    Room createRoom(long ownerId, String name);

    /**
     * Registra una habitación ya identificada (usado al cargar la configuración del sitio).
     */
    Room addRoom(Room room, Schedule schedule);

    /**
     * @return true si la habitación existía y se actualizó su horario
     */
    boolean updateSchedule(long ownerId, long roomId, Schedule schedule);

    /**
     * @return true si la habitación existía y se borró junto con su horario
     */
    boolean deleteRoom(long ownerId, long roomId);
}
