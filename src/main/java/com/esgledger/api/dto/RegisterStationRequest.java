package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterStationRequest {

    @NotBlank(message = "Station ID is required")
    private String stationId;

    @NotBlank(message = "Operator ID is required")
    private String operatorId;
}
