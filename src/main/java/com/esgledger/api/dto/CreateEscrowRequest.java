package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.Instant;

/**
 * DTO for opening an escrow between a buyer and a seller.
 */
@Data
public class CreateEscrowRequest {

    @NotBlank(message = "Escrow ID is required")
    private String escrowId;

    @NotBlank(message = "Buyer ID is required")
    private String buyerId;

    @NotBlank(message = "Seller ID is required")
    private String sellerId;

    @Positive(message = "Amount must be positive")
    private long amount;

    private String contractHash;

    @NotNull(message = "Deadline is required")
    private Instant deadline;
}
