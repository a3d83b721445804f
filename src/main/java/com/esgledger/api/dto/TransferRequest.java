package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for moving tokens from the caller to another account.
 */
@Data
public class TransferRequest {

    @NotBlank(message = "Recipient ID is required")
    private String recipientId;

    @Positive(message = "Amount must be positive")
    private long amount;

    private String memo;
}
