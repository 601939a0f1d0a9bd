package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

//dto con el clima actual en la ubicacion del dueño
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeatherResponse {
    @JsonProperty("temperature")
    private double temperature;

    @JsonProperty("weather_condition")
    private String weatherCondition;

    @JsonProperty("location")
    private String location;

    @JsonProperty("timestamp")
    private String timestamp;
}
