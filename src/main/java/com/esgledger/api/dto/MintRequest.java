package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * DTO for minting against an issued grant.
 */
@Data
public class MintRequest {

    @NotBlank(message = "Recipient ID is required")
    private String recipientId;

    @Positive(message = "Amount must be positive")
    private long amount;

    @NotBlank(message = "Grant ID is required")
    private String grantId;
}
