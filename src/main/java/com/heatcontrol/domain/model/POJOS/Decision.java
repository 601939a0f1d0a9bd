package com.heatcontrol.domain.model.POJOS;

/**
 * Veredicto de calefacción para una habitación.
 * Se recalcula en cada consulta y nunca se persiste.
 */
public class Decision {
    private final long roomId;
    private final double targetTemperature;
    private final Sample latestSample;
    private final boolean heatingOn;

    public Decision(long roomId, double targetTemperature, Sample latestSample, boolean heatingOn) {
        this.roomId = roomId;
        this.targetTemperature = targetTemperature;
        this.latestSample = latestSample;
        this.heatingOn = heatingOn;
    }

    public long getRoomId() { return roomId; }
    public double getTargetTemperature() { return targetTemperature; }
    public Sample getLatestSample() { return latestSample; }
    public boolean isHeatingOn() { return heatingOn; }

    @Override
    public String toString() {
        return "Decision{" +
                "roomId=" + roomId +
                ", targetTemperature=" + targetTemperature +
                ", latestSample=" + latestSample +
                ", heatingOn=" + heatingOn +
                '}';
    }
}
