package com.esgledger.api.dto;

import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class BurnRequest {

    @Positive(message = "Amount must be positive")
    private long amount;
}
