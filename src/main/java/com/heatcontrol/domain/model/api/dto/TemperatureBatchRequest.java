package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Lote de lecturas para una habitación.
 * timestamps es opcional y se alinea por índice con temperatures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemperatureBatchRequest {
    @JsonProperty("room_id")
    private Long roomId;

    @JsonProperty("temperatures")
    private List<Double> temperatures;

    @JsonProperty("timestamps")
    private List<String> timestamps;
}
