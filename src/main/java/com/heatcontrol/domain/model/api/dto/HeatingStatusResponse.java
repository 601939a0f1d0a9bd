package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto con la decision de calefaccion de una habitacion
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeatingStatusResponse {
    @JsonProperty("room_id")
    private long roomId;

    @JsonProperty("target_temperature")
    private double targetTemperature;

    @JsonProperty("current_temperature")
    private double currentTemperature;

    @JsonProperty("measured_at")
    private String measuredAt;

    @JsonProperty("heating_on")
    private boolean heatingOn;
}
