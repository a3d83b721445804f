package com.esgledger.api.dto;

import com.esgledger.governance.ProposalType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for submitting a committee proposal.
 *
 * The payload is a JSON document whose shape depends on the type, e.g.
 * {@code {"recipient":"farmer-1","amount":5000}} for MINT.
 */
@Data
public class ProposalRequest {

    @NotBlank(message = "Proposal ID is required")
    private String proposalId;

    @NotNull(message = "Proposal type is required")
    private ProposalType type;

    private String payload;
}
