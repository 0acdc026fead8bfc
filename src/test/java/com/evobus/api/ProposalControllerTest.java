package com.evobus.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "evolution.scheduling.enabled=false")
@AutoConfigureMockMvc
class ProposalControllerTest {

    @Autowired MockMvc mvc;

    @Nested
    @DisplayName("POST /v1/proposals")
    class Propose {

        @Test
        void safeChange_isAppliedImmediately() throws Exception {
            mvc.perform(post("/v1/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"agent_type": "doc_agent",
                         "change": {"type": "fix_typo", "file": "README.md"},
                         "metadata": {"impact_score": 2, "risk_score": 1}}
                        """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("applied"))
                .andExpect(jsonPath("$.agent_type").value("doc_agent"))
                .andExpect(jsonPath("$.priority_score").value(2.0));
        }

        @Test
        void missingChangeType_is400() throws Exception {
            mvc.perform(post("/v1/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"agent_type\": \"doc_agent\", \"change\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.reason").value("invalid_change"))
                .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        void blastRadiusAboveProfile_is400() throws Exception {
            mvc.perform(post("/v1/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"agent_type": "doc_agent",
                         "change": {"type": "rewrite"},
                         "metadata": {"blast_radius": "high"}}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("blast_radius_exceeded"));
        }

        @Test
        void malformedJson_is400() throws Exception {
            mvc.perform(post("/v1/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }
    }

    @Test
    void unknownProposal_is404() throws Exception {
        mvc.perform(get("/v1/proposals/prp-missing/status"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    void rollbackOfUnknownProposal_is404() throws Exception {
        mvc.perform(post("/v1/proposals/prp-missing/rollback"))
            .andExpect(status().isNotFound());
    }

    @Test
    void unknownStatusFilter_is400() throws Exception {
        mvc.perform(get("/v1/proposals").param("status", "sideways"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void invalidSafetyProfile_is400() throws Exception {
        mvc.perform(post("/v1/safety-profiles")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"agent_type": "api_agent", "error_threshold": 1.5, "needs_consensus": true,
                     "max_blast_radius": "low", "auto_rollback": true, "success_rate": 0.9, "cost_factor": 1.0}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.reason").value("error_threshold_out_of_range"));
    }
}
