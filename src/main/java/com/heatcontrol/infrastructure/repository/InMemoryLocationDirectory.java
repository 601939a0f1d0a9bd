package com.heatcontrol.infrastructure.repository;

import com.heatcontrol.domain.model.POJOS.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLocationDirectory implements ILocationDirectory {

    private final Map<Long, Location> locationsByOwner = new ConcurrentHashMap<>();

    public InMemoryLocationDirectory(List<Location> locations) {
        for (Location location : locations) {
            locationsByOwner.put(location.getOwnerId(), location);
        }
    }

    @Override
    public List<Location> listLocations() {
        List<Location> locations = new ArrayList<>(locationsByOwner.values());
        locations.sort((a, b) -> Long.compare(a.getOwnerId(), b.getOwnerId()));
        return locations;
    }

    @Override
    public Optional<Location> findLocation(long ownerId) {
        return Optional.ofNullable(locationsByOwner.get(ownerId));
    }
}
