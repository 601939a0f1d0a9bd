package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchIngestResponse {
    @JsonProperty("message")
    private String message;

    @JsonProperty("count")
    private int count;
}
