package com.venturegate.api;

import com.venturegate.orchestrator.OrchestratorNotifier;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class GatePolicyControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean OrchestratorNotifier notifier;

    private final String actor = "consultant-" + UUID.randomUUID().toString().substring(0, 8);

    @Test
    void listsEveryGateWithDefaults() throws Exception {
        mockMvc.perform(get("/v1/settings/gate-policies").header(ActorHeader.NAME, actor))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(3)))
            .andExpect(jsonPath("$[0].policy.gate").value("DESIRABILITY"))
            .andExpect(jsonPath("$[0].policy.isCustom").value(false))
            .andExpect(jsonPath("$[0].defaults.minExperiments").value(3))
            .andExpect(jsonPath("$[2].policy.thresholds.ltv_cac_ratio").value(3.0));
    }

    @Test
    void partialUpdateInheritsDefaultsAndResetRestoresThem() throws Exception {
        mockMvc.perform(put("/v1/settings/gate-policies/{gate}", "desirability")
                .header(ActorHeader.NAME, actor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minExperiments\": 5, \"requiredFitTypes\": [\"Desirability\", \"viability\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Gate policy saved successfully"))
            .andExpect(jsonPath("$.policy.isCustom").value(true))
            .andExpect(jsonPath("$.policy.minExperiments").value(5))
            .andExpect(jsonPath("$.policy.minStrongEvidence").value(1))
            .andExpect(jsonPath("$.policy.requiredFitTypes[1]").value("Viability"))
            .andExpect(jsonPath("$.policy.requiresApproval").value(true));

        mockMvc.perform(get("/v1/settings/gate-policies/{gate}", "Desirability").header(ActorHeader.NAME, actor))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.policy.minExperiments").value(5))
            .andExpect(jsonPath("$.defaults.minExperiments").value(3));

        mockMvc.perform(delete("/v1/settings/gate-policies/{gate}", "desirability").header(ActorHeader.NAME, actor))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Gate policy reset to defaults"))
            .andExpect(jsonPath("$.policy.isCustom").value(false))
            .andExpect(jsonPath("$.policy.minExperiments").value(3));

        // idempotent
        mockMvc.perform(delete("/v1/settings/gate-policies/{gate}", "desirability").header(ActorHeader.NAME, actor))
            .andExpect(status().isOk());
    }

    @Test
    void outOfRangeValuesAreRejectedNotClamped() throws Exception {
        mockMvc.perform(put("/v1/settings/gate-policies/{gate}", "feasibility")
                .header(ActorHeader.NAME, actor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minExperiments\": 0, \"minStrongEvidence\": 11}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("POLICY_VALIDATION_FAILED"))
            .andExpect(jsonPath("$.details", hasSize(2)))
            .andExpect(jsonPath("$.details[0]", startsWith("minExperiments")));

        mockMvc.perform(get("/v1/settings/gate-policies/{gate}", "feasibility").header(ActorHeader.NAME, actor))
            .andExpect(jsonPath("$.policy.isCustom").value(false))
            .andExpect(jsonPath("$.policy.minExperiments").value(2));
    }

    @Test
    void unknownGateAndMissingActorAreRejected() throws Exception {
        mockMvc.perform(get("/v1/settings/gate-policies/{gate}", "profitability").header(ActorHeader.NAME, actor))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_GATE"));

        mockMvc.perform(get("/v1/settings/gate-policies"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error_code").value("UNAUTHENTICATED"));

        mockMvc.perform(put("/v1/settings/gate-policies/{gate}", "viability")
                .header(ActorHeader.NAME, actor)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"minExperiments\": \"lots\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }
}
