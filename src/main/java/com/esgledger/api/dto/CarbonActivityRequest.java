package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for reporting a verified carbon reduction.
 */
@Data
public class CarbonActivityRequest {

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @Positive(message = "Carbon reduction must be positive")
    private long carbonKg;

    private String activityRef;
}
