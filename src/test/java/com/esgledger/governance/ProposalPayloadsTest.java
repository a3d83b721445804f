package com.esgledger.governance;

import com.esgledger.common.exception.InvalidAmountException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProposalPayloadsTest {

    private final ProposalPayloads payloads = new ProposalPayloads(new ObjectMapper());

    @Test
    void testMintPayloadParsed() {
        ProposalPayloads.MintPayload mint = payloads.mint("{\"recipient\":\"farmer-1\",\"amount\":5000}");

        assertEquals("farmer-1", mint.getRecipient());
        assertEquals(5000L, mint.getAmount());
    }

    @Test
    void testMintPayloadNeedsRecipientAndPositiveAmount() {
        assertThrows(InvalidAmountException.class, () -> payloads.mint("{\"amount\":5000}"));
        assertThrows(InvalidAmountException.class, () -> payloads.mint("{\"recipient\":\"x\",\"amount\":0}"));
        assertThrows(InvalidAmountException.class, () -> payloads.mint(null));
        assertThrows(InvalidAmountException.class, () -> payloads.mint("{broken"));
    }

    @Test
    void testHoldTypesNeedNoPayload() {
        assertDoesNotThrow(() -> payloads.validate(ProposalType.PAUSE, null));
        assertDoesNotThrow(() -> payloads.validate(ProposalType.TEXT, "free text"));
        assertThrows(InvalidAmountException.class, () -> payloads.validate(ProposalType.FREEZE, "{}"));
    }
}
