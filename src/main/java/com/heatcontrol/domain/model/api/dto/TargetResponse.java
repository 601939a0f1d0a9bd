package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetResponse {
    @JsonProperty("room_id")
    private long roomId;

    @JsonProperty("at")
    private String at;

    @JsonProperty("target_temperature")
    private double targetTemperature;
}
