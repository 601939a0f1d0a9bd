package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TemperatureResponse {
    @JsonProperty("time")
    private String time;

    @JsonProperty("value")
    private double value;

    // null para la serie de clima exterior
    @JsonProperty("room_id")
    private Long roomId;
}
