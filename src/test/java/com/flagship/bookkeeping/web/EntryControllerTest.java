package com.flagship.bookkeeping.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.bookkeeping.LedgerTestDatabase;
import com.flagship.bookkeeping.ledger.LedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class EntryControllerTest {

    private static final String BALANCED = "{\"accounting_date\":\"2024-03-07\",\"entry_type\":\"GENERAL\"," +
        "\"entry_title\":\"Salary\",\"lines\":[" +
        "{\"account_code\":\"0000000001\",\"dc\":\"D\",\"amount_domestic\":100,\"currency_original\":\"GBP\"}," +
        "{\"account_code\":\"4000000000\",\"dc\":\"C\",\"amount_domestic\":100,\"currency_original\":\"GBP\"}]}";

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        LedgerTestDatabase.register(registry, "entry-api");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        LedgerTestDatabase.clean(jdbcTemplate);
    }

    private UUID createEntry() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BALANCED))
            .andExpect(status().isCreated())
            .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(body.get("entry_uuid").asText());
    }

    @Test
    @DisplayName("Entry is created, read back, replaced and deleted")
    void testEntryLifecycle() throws Exception {
        UUID entryUuid = createEntry();

        mockMvc.perform(get("/api/entries/{id}", entryUuid))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.entry_type").value("GENERAL"))
            .andExpect(jsonPath("$.accounting_date").value("2024-03-07"))
            .andExpect(jsonPath("$.has_attachment").value(false))
            .andExpect(jsonPath("$.lines", hasSize(2)))
            .andExpect(jsonPath("$.lines[0].line_no").value(1))
            .andExpect(jsonPath("$.lines[0].account_name").value("Cash"));

        mockMvc.perform(put("/api/entries/{id}", entryUuid)
                .contentType(MediaType.APPLICATION_JSON)
                .content(BALANCED.replace("2024-03-07", "2024-03-09")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accounting_date").value("2024-03-09"));

        mockMvc.perform(delete("/api/entries/{id}", entryUuid))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/entries/{id}", entryUuid))
            .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/entries/{id}", entryUuid))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Unbalanced entry is 400 with the ledger's message")
    void testUnbalancedEntry() throws Exception {
        mockMvc.perform(post("/api/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BALANCED.replace("\"amount_domestic\":100,\"currency_original\":\"GBP\"}]",
                    "\"amount_domestic\":90,\"currency_original\":\"GBP\"}]")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"))
            .andExpect(jsonPath("$.message").value("Debit/Credit not balanced (domestic). diff=10.000000"));

        assertEquals(0L, ledgerService.countEntries());
    }

    @Test
    @DisplayName("Balanced but oversized amounts are 400 and the balance sheet stays readable")
    void testOversizedAmounts() throws Exception {
        mockMvc.perform(post("/api/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BALANCED.replace("\"amount_domestic\":100", "\"amount_domestic\":1e400")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("VALIDATION"))
            .andExpect(jsonPath("$.field").value("amount_domestic"));

        assertEquals(0L, ledgerService.countEntries());
        mockMvc.perform(get("/api/reports/balance-sheet"))
            .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Replacing a missing entry is 404")
    void testReplaceMissing() throws Exception {
        mockMvc.perform(put("/api/entries/{id}", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(BALANCED))
            .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/entries/not-a-uuid"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Attachment is uploaded, downloaded and removed")
    void testAttachmentEndpoints() throws Exception {
        UUID entryUuid = createEntry();
        byte[] content = {(byte) 0x89, 'P', 'N', 'G'};

        mockMvc.perform(multipart(HttpMethod.PUT, "/api/entries/{id}/attachment", entryUuid)
                .file(new MockMultipartFile("file", "receipt.png", null, content)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mime_type").value("image/png"))
            .andExpect(jsonPath("$.size").value(4));

        mockMvc.perform(get("/api/entries/{id}/attachment", entryUuid))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG))
            .andExpect(content().bytes(content));

        mockMvc.perform(get("/api/entries/{id}", entryUuid))
            .andExpect(jsonPath("$.has_attachment").value(true));

        mockMvc.perform(multipart(HttpMethod.PUT, "/api/entries/{id}/attachment", entryUuid)
                .file(new MockMultipartFile("file", "notes.txt", "text/plain", content)))
            .andExpect(status().isBadRequest());

        mockMvc.perform(delete("/api/entries/{id}/attachment", entryUuid))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/entries/{id}/attachment", entryUuid))
            .andExpect(status().isNotFound());
    }
}
