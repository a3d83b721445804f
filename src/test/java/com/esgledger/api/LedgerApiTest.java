package com.esgledger.api;

import com.esgledger.api.dto.CreateEscrowRequest;
import com.esgledger.api.dto.OptInRequest;
import com.esgledger.api.dto.TransferRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests the REST layer's caller header handling and error-kind to status mapping.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class LedgerApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void optIn(String accountId) throws Exception {
        OptInRequest request = new OptInRequest();
        request.setAccountId(accountId);
        mockMvc.perform(post("/api/v1/ledger/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.accountId").value(accountId))
            .andExpect(jsonPath("$.balance").value(0));
    }

    @Test
    void testOptInAndQueryAccount() throws Exception {
        optIn("farmer-1");

        mockMvc.perform(get("/api/v1/ledger/accounts/farmer-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.frozen").value(false));
    }

    @Test
    void testUnknownAccountIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/ledger/accounts/nobody"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("NOT_FOUND"));
    }

    @Test
    void testNonAdminPauseIsForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/ledger/pause")
                .header("X-Caller-Id", "farmer-1")
                .param("paused", "true"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));
    }

    @Test
    void testMissingCallerHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/ledger/pause").param("paused", "true"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testOverdraftIsUnprocessable() throws Exception {
        optIn("farmer-1");
        optIn("buyer-1");
        TransferRequest request = new TransferRequest();
        request.setRecipientId("buyer-1");
        request.setAmount(10L);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header("X-Caller-Id", "farmer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    void testPausedTransferIsLocked() throws Exception {
        optIn("farmer-1");
        optIn("buyer-1");
        mockMvc.perform(post("/api/v1/ledger/pause")
                .header("X-Caller-Id", "test-admin")
                .param("paused", "true"))
            .andExpect(status().isOk());

        TransferRequest request = new TransferRequest();
        request.setRecipientId("buyer-1");
        request.setAmount(10L);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header("X-Caller-Id", "farmer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isLocked());
    }

    @Test
    void testInvalidBodyIsBadRequest() throws Exception {
        TransferRequest request = new TransferRequest();
        request.setAmount(0L);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header("X-Caller-Id", "farmer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.recipientId").exists())
            .andExpect(jsonPath("$.amount").exists());
    }

    @Test
    void testEscrowStateConflict() throws Exception {
        CreateEscrowRequest request = new CreateEscrowRequest();
        request.setEscrowId("e-1");
        request.setBuyerId("buyer-1");
        request.setSellerId("farmer-1");
        request.setAmount(100L);
        request.setDeadline(Instant.now().plusSeconds(86_400));

        mockMvc.perform(post("/api/v1/escrows")
                .header("X-Caller-Id", "buyer-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("CREATED"));

        mockMvc.perform(post("/api/v1/escrows/e-1/shipment")
                .header("X-Caller-Id", "farmer-1"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("INVALID_STATE"));
    }

    @Test
    void testHoldingAccountIdentityIsForbidden() throws Exception {
        optIn("buyer-1");
        OptInRequest optIn = new OptInRequest();
        optIn.setAccountId("escrow-holding");

        mockMvc.perform(post("/api/v1/ledger/accounts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(optIn)))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));

        TransferRequest request = new TransferRequest();
        request.setRecipientId("buyer-1");
        request.setAmount(10L);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header("X-Caller-Id", "escrow-holding")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));
    }
}
