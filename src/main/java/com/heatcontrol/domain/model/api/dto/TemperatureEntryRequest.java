package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto para registrar una lectura de temperatura con la hora actual
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TemperatureEntryRequest {
    @JsonProperty("room_id")
    private Long roomId;

    @JsonProperty("temperature")
    private Double temperature;
}
