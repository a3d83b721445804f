package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SettlementRequest {

    @NotBlank(message = "Settlement ID is required")
    private String settlementId;

    private String period;
}
