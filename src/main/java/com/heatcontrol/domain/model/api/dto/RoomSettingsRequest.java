package com.heatcontrol.domain.model.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nuevo horario de una habitación. Las horas van como "HH:mm".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomSettingsRequest {
    @JsonProperty("timezone")
    private String timezone;

    @JsonProperty("wanted_temp_day")
    private Double wantedTempDay;

    @JsonProperty("wanted_temp_night")
    private Double wantedTempNight;

    @JsonProperty("night_start")
    private String nightStart;

    @JsonProperty("night_end")
    private String nightEnd;
}
