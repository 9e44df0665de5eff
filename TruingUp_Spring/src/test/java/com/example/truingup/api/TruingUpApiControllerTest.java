package com.example.truingup.api;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.AuditVerification;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.PetitionProcessor;
import com.example.truingup.engine.RuleEngine;
import com.example.truingup.engine.RuleSets;
import com.example.truingup.engine.exception.HumanVerificationRequiredException;
import com.example.truingup.engine.exception.RuleSetNotFoundException;
import com.example.truingup.service.AuditTrailService;
import com.example.truingup.service.ScenarioSnapshotService;
import com.example.truingup.service.TruingUpService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TruingUpApiController.class)
class TruingUpApiControllerTest {

    private static final String OM_GAIN = """
            {"head": "O&M", "category": "Controllable", "sbu_code": "SBU-D",
             "approved": 150, "actual": 120, "is_human_verified": true}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TruingUpService truingUpService;

    @MockBean
    private AuditTrailService auditTrailService;

    @MockBean
    private ScenarioSnapshotService scenarioSnapshotService;

    private final RuleEngine engine = new RuleEngine(RuleSets.ksercMyt2022To27());

    private AuditResult omGain() {
        return engine.computeVariance(CostInput.builder()
                .head("O&M").category("Controllable").sbuCode("SBU-D")
                .approved(new BigDecimal("150")).actual(new BigDecimal("120")).humanVerified(true)
                .build());
    }

    @Nested
    @DisplayName("POST /variance")
    class Variance {

        @Test
        @DisplayName("returns the audit result in snake_case")
        void computes() throws Exception {
            AuditResult result = omGain();
            given(truingUpService.computeVariance(any(CostInput.class), isNull())).willReturn(result);

            mockMvc.perform(post("/api/truing-up/variance").contentType(MediaType.APPLICATION_JSON).content(OM_GAIN))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.checksum").value(result.checksum()))
                    .andExpect(jsonPath("$.sbu_code").value("SBU-D"))
                    .andExpect(jsonPath("$.variance_category").value("Controllable"))
                    .andExpect(jsonPath("$.passed_through_variance").value(10.0))
                    .andExpect(jsonPath("$.regulatory_reference.clause").value("Regulation 9.2: Controllable Gains Sharing"))
                    .andExpect(jsonPath("$.input_snapshot.is_human_verified").value(true));
            verify(auditTrailService, never()).record(any());
        }

        @Test
        @DisplayName("persist=true appends the result to the audit trail")
        void persists() throws Exception {
            AuditResult result = omGain();
            given(truingUpService.computeVariance(any(CostInput.class), eq(RuleSets.KSERC_MYT_2022_27_V1)))
                    .willReturn(result);

            mockMvc.perform(post("/api/truing-up/variance")
                            .param("version", RuleSets.KSERC_MYT_2022_27_V1)
                            .param("persist", "true")
                            .contentType(MediaType.APPLICATION_JSON).content(OM_GAIN))
                    .andExpect(status().isOk());
            verify(auditTrailService).record(result);
        }

        @Test
        @DisplayName("a lowercase category is a 400 naming the accepted labels")
        void invalidCategory() throws Exception {
            String body = OM_GAIN.replace("\"Controllable\"", "\"controllable\"");

            mockMvc.perform(post("/api/truing-up/variance").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid Cost Input"))
                    .andExpect(jsonPath("$.message").value(containsString("Accepted values: [Controllable, Uncontrollable]")));
        }

        @Test
        @DisplayName("an unverified actual is a 422")
        void unverified() throws Exception {
            given(truingUpService.computeVariance(any(CostInput.class), any()))
                    .willThrow(new HumanVerificationRequiredException("O&M", new BigDecimal("120")));

            mockMvc.perform(post("/api/truing-up/variance").contentType(MediaType.APPLICATION_JSON).content(OM_GAIN))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.message").value(containsString("ZERO-HALLUCINATION VIOLATION")));
        }

        @Test
        @DisplayName("malformed JSON is a 400")
        void malformed() throws Exception {
            mockMvc.perform(post("/api/truing-up/variance").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid Request"));
        }
    }

    @Test
    @DisplayName("POST /petition returns the consolidated report without persisting by default")
    void petition() throws Exception {
        CostInput power = CostInput.builder()
                .head("Power_Purchase").category("Uncontrollable").sbuCode("SBU-G")
                .approved(new BigDecimal("400")).actual(new BigDecimal("450")).humanVerified(true)
                .build();
        PetitionReport report = new PetitionProcessor(engine).processPetition("2024-25",
                List.of(omGain().inputSnapshot(), power));
        given(truingUpService.processPetition(eq("2024-25"), any(), isNull())).willReturn(report);

        String body = "{\"financial_year\": \"2024-25\", \"items\": [" + OM_GAIN + ","
                + "{\"head\": \"Power_Purchase\", \"category\": \"Uncontrollable\", \"sbu_code\": \"SBU-G\","
                + " \"approved\": 400, \"actual\": 450, \"is_human_verified\": true}]}";

        mockMvc.perform(post("/api/truing-up/petition").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_revenue_gap").value(-20.0))
                .andExpect(jsonPath("$.total_items_processed").value(2))
                .andExpect(jsonPath("$.sbu_summaries.length()").value(2))
                .andExpect(jsonPath("$.batch_checksum").value(report.batchChecksum()));
        verify(auditTrailService, never()).recordAll(any());
    }

    @Test
    @DisplayName("a null petition item is a 400 and nothing is computed")
    void nullPetitionItem() throws Exception {
        String body = "{\"financial_year\": \"2024-25\", \"items\": [" + OM_GAIN + ", null]}";

        mockMvc.perform(post("/api/truing-up/petition").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Cost Input"))
                .andExpect(jsonPath("$.message").value("items[1] is null"));
        verify(truingUpService, never()).processPetition(any(), any(), any());
    }

    @Test
    @DisplayName("a scenario without items is a 400")
    void scenarioWithoutItems() throws Exception {
        mockMvc.perform(post("/api/truing-up/scenarios").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": \"base_case\", \"items\": null}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("items is required"));
        verify(scenarioSnapshotService, never()).createSnapshot(any(), any(), any(), any());
    }

    @Test
    @DisplayName("GET /td-loss-target returns the trajectory value")
    void tdLossTarget() throws Exception {
        given(truingUpService.tdLossTarget("2024-25", null)).willReturn(new BigDecimal("0.145"));

        mockMvc.perform(get("/api/truing-up/td-loss-target").param("financialYear", "2024-25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.financial_year").value("2024-25"))
                .andExpect(jsonPath("$.td_loss_target").value(0.145));
    }

    @Test
    @DisplayName("an unknown rule version is a 404")
    void unknownVersion() throws Exception {
        given(truingUpService.tdLossTarget("2024-25", "KSERC-MYT-2017-22"))
                .willThrow(new RuleSetNotFoundException("KSERC-MYT-2017-22", List.of(RuleSets.KSERC_MYT_2022_27_V1)));

        mockMvc.perform(get("/api/truing-up/td-loss-target")
                        .param("financialYear", "2024-25")
                        .param("version", "KSERC-MYT-2017-22"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("GET /normative-interest delegates with the loan amount")
    void normativeInterest() throws Exception {
        given(truingUpService.normativeInterest(any(BigDecimal.class), isNull()))
                .willReturn(engine.computeNormativeInterest(new BigDecimal("1000000")));

        mockMvc.perform(get("/api/truing-up/normative-interest").param("outstandingLoan", "1000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.normative_interest").value(105000.0))
                .andExpect(jsonPath("$.formula").value("1000000 × (0.0850 + 0.02)"));
    }

    @Test
    @DisplayName("GET /audit/{checksum}/verify reports integrity")
    void verifyAudit() throws Exception {
        String checksum = "a".repeat(64);
        given(auditTrailService.verify(checksum))
                .willReturn(new AuditVerification(checksum, checksum, true, RuleSets.KSERC_MYT_2022_27_V1));

        mockMvc.perform(get("/api/truing-up/audit/{checksum}/verify", checksum))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intact").value(true))
                .andExpect(jsonPath("$.engine_version").value(RuleSets.KSERC_MYT_2022_27_V1));
    }
}
