package com.finopsguard.api;

import com.finopsguard.policy.Policy;
import com.finopsguard.policy.PolicyStore;
import com.finopsguard.policy.ViolationMode;
import com.finopsguard.policy.dsl.PolicyDslParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PolicyControllerTest {

    private PolicyStore policyStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        policyStore = new PolicyStore();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PolicyController(policyStore, new PolicyDslParser()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should register a policy from fields and a rule string")
    void shouldCreateFromFields() throws Exception {
        // When
        mockMvc.perform(post("/api/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"id": "no_gpu", "name": "No GPU",
                                 "rule": "resource.type == 'aws_gpu_instance'", "onViolation": "block"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("no_gpu"))
                .andExpect(jsonPath("$.rule").value("resource.type == \"aws_gpu_instance\""))
                .andExpect(jsonPath("$.onViolation").value("block"));

        // Then
        assertThat(policyStore.get("no_gpu")).get()
                .extracting(Policy::getOnViolation).isEqualTo(ViolationMode.BLOCK);
    }

    @Test
    @DisplayName("Should register a policy from a DSL definition")
    void shouldCreateFromDsl() throws Exception {
        mockMvc.perform(post("/api/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dsl\": \"policy \\\"Team cap\\\" { budget = 500 }\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("team_cap"))
                .andExpect(jsonPath("$.budget").value(500.0));
    }

    @Test
    @DisplayName("Should reject policies that cannot be evaluated")
    void shouldRejectInvalidPolicies() throws Exception {
        mockMvc.perform(post("/api/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"empty\", \"name\": \"Empty\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Policy 'empty' has neither a budget nor an expression"));

        mockMvc.perform(post("/api/v1/policies")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"bad\", \"rule\": \"resource.type ==\"}"))
                .andExpect(status().isBadRequest());

        assertThat(policyStore.list()).isEmpty();
    }

    @Test
    @DisplayName("Should update, fetch and delete by id")
    void shouldManageLifecycle() throws Exception {
        // Given
        policyStore.add(Policy.builder().id("cap").name("cap").budget(100.0).build());

        // When / Then
        mockMvc.perform(put("/api/v1/policies/cap")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"cap\", \"budget\": 250}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("cap"))
                .andExpect(jsonPath("$.budget").value(250.0));

        mockMvc.perform(get("/api/v1/policies/cap"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));

        mockMvc.perform(delete("/api/v1/policies/cap"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/policies/cap"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Policy not found: cap"));
    }
}
