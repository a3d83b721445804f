package com.esgledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for opening a ledger account.
 */
@Data
public class OptInRequest {

    @NotBlank(message = "Account ID is required")
    private String accountId;
}
