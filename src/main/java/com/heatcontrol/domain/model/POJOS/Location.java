package com.heatcontrol.domain.model.POJOS;

// Ubicación de un dueño, usada por el refresco de clima exterior
public class Location {
    private final long ownerId;
    private final double latitude;
    private final double longitude;

    public Location(long ownerId, double latitude, double longitude) {
        this.ownerId = ownerId;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public long getOwnerId() {
        return ownerId;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public String toString() {
        return "Location{" +
                "ownerId=" + ownerId +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                '}';
    }
}
