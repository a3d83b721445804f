package com.esgledger.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for a gross charging transaction reported by a station.
 */
@Data
public class StationTransactionRequest {

    @Positive(message = "Gross amount must be positive")
    private long grossAmount;

    private String externalRef;
}
