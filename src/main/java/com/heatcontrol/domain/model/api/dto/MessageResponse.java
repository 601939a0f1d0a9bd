package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Respuesta genérica con un mensaje, usada tanto para confirmaciones como para errores.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {
    @JsonProperty("message")
    private String message;
}
