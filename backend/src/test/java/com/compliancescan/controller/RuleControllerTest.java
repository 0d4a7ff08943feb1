package com.compliancescan.controller;

import com.compliancescan.parser.WordRuleParser;
import com.compliancescan.service.RuleService;
import com.compliancescan.store.InMemoryRuleCatalog;
import com.compliancescan.store.ReviewQueue;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class RuleControllerTest {

    private static final String FIN_002 = """
            {"ruleCode": "FIN-002", "description": "大额交易必须经过核验",
             "evaluationCriteria": "金额超过 10000 的交易必须已核验", "severity": "CRITICAL", "active": true}
            """;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RuleService ruleService = new RuleService(new InMemoryRuleCatalog(), new WordRuleParser(), new ReviewQueue());
        mockMvc = MockMvcBuilders.standaloneSetup(new RuleController(ruleService)).build();
    }

    @Test
    void shouldCreateRule() throws Exception {
        mockMvc.perform(post("/api/rules").contentType(MediaType.APPLICATION_JSON).content(FIN_002))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.ruleCode").value("FIN-002"))
                .andExpect(jsonPath("$.severity").value("CRITICAL"));

        mockMvc.perform(get("/api/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void shouldRejectDuplicateRuleCode() throws Exception {
        mockMvc.perform(post("/api/rules").contentType(MediaType.APPLICATION_JSON).content(FIN_002))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/rules").contentType(MediaType.APPLICATION_JSON).content(FIN_002))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void shouldRequireDescription() throws Exception {
        mockMvc.perform(post("/api/rules").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ruleCode\": \"FIN-003\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldDeactivateRuleAndRejectUnknownSeverity() throws Exception {
        String body = mockMvc.perform(post("/api/rules").contentType(MediaType.APPLICATION_JSON).content(FIN_002))
                .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);
        String id = JsonPath.read(body, "$.id");

        mockMvc.perform(patch("/api/rules/" + id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(patch("/api/rules/" + id).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"severity\": \"URGENT\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundWhenPatchingUnknownRule() throws Exception {
        mockMvc.perform(patch("/api/rules/nope").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"active\": true}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectNonDocxUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "rules.txt", "text/plain",
                "FIN-002".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/rules/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }
}
