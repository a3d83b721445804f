package com.esgledger.governance;

import com.esgledger.common.Amounts;
import com.esgledger.common.exception.InvalidAmountException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the typed arguments out of a proposal's JSON payload.
 */
@Component
@RequiredArgsConstructor
public class ProposalPayloads {

    private final ObjectMapper objectMapper;

    /**
     * Check that a payload carries what its proposal type needs.
     *
     * @throws InvalidAmountException if the payload is malformed or incomplete
     */
    public void validate(ProposalType type, String payload) {
        switch (type) {
            case MINT -> mint(payload);
            case FREEZE, UNFREEZE -> account(payload);
            case PAUSE, UNPAUSE, TEXT -> {
                // no arguments
            }
        }
    }

    public MintPayload mint(String payload) {
        MintPayload mint = read(payload, MintPayload.class);
        if (mint.getRecipient() == null || mint.getRecipient().isBlank()) {
            throw new InvalidAmountException("Mint proposal must name a recipient");
        }
        Amounts.requirePositive(mint.getAmount(), "Mint proposal amount");
        return mint;
    }

    public AccountPayload account(String payload) {
        AccountPayload account = read(payload, AccountPayload.class);
        if (account.getAccount() == null || account.getAccount().isBlank()) {
            throw new InvalidAmountException("Proposal must name an account");
        }
        return account;
    }

    private <T> T read(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidAmountException("Proposal payload is required");
        }
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new InvalidAmountException("Malformed proposal payload: " + e.getOriginalMessage(), e);
        }
    }

    @Data
    @NoArgsConstructor
    public static class MintPayload {
        private String recipient;
        private long amount;
    }

    @Data
    @NoArgsConstructor
    public static class AccountPayload {
        private String account;
    }
}
