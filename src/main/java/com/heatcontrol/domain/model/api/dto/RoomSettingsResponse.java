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
public class RoomSettingsResponse {
    @JsonProperty("room_id")
    private long roomId;

    @JsonProperty("timezone")
    private String timezone;

    @JsonProperty("wanted_temp_day")
    private double wantedTempDay;

    @JsonProperty("wanted_temp_night")
    private double wantedTempNight;

    @JsonProperty("night_start")
    private String nightStart;

    @JsonProperty("night_end")
    private String nightEnd;
}
