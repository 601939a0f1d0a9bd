package com.heatcontrol.infrastructure.repository;

import com.heatcontrol.domain.model.POJOS.Location;

import java.util.List;
import java.util.Optional;

// Directorio de ubicaciones de los dueños (solo lectura para el núcleo)
public interface ILocationDirectory {

    List<Location> listLocations();

    Optional<Location> findLocation(long ownerId);
}
