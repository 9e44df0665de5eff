package com.example.truingup;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.RuleSetRegistry;
import com.example.truingup.engine.RuleSets;
import com.example.truingup.entity.AuditTrail;
import com.example.truingup.repository.AuditTrailRepository;
import com.example.truingup.service.AuditTrailService;
import com.example.truingup.service.TruingUpService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TruingUpApplicationTests {

    private static final String LONG_HEAD = "Repairs_and_Maintenance_of_33kV_and_11kV_Distribution_Lines";

    @Autowired
    private RuleSetRegistry ruleSetRegistry;

    @Autowired
    private TruingUpService truingUpService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private AuditTrailRepository auditTrailRepository;

    @Autowired
    private MockMvc mockMvc;

    private static CostInput item(String head, String category, String sbu, String approved, String actual) {
        return CostInput.builder()
                .head(head).category(category).sbuCode(sbu)
                .approved(new BigDecimal(approved)).actual(new BigDecimal(actual)).humanVerified(true)
                .build();
    }

    private static String itemJson(String head, String category, String sbu, String approved, String actual) {
        return "{\"head\": \"" + head + "\", \"category\": \"" + category + "\", \"sbu_code\": \"" + sbu + "\","
                + " \"approved\": " + approved + ", \"actual\": " + actual + ", \"is_human_verified\": true}";
    }

    @Test
    void contextLoads() {
        assertThat(ruleSetRegistry.active().getVersion()).isEqualTo(RuleSets.KSERC_MYT_2022_27_V1);
    }

    @Test
    void computeRecordAndVerify() {
        AuditResult result = truingUpService.computeVariance(CostInput.builder()
                .head("Repairs_Maintenance").category("Controllable").sbuCode("SBU-T")
                .approved(new BigDecimal("1250000.50")).actual(new BigDecimal("1190000.25"))
                .anomalyScore(0.12).evidencePage(44).humanVerified(true)
                .build(), null);

        AuditTrail row = auditTrailService.record(result);

        assertThat(row.getAuditId()).isNotNull();
        assertThat(auditTrailService.verify(result.checksum()).intact()).isTrue();
        assertThat(auditTrailService.record(result).getAuditId()).isEqualTo(row.getAuditId());
    }

    @Nested
    @DisplayName("persisting a petition")
    class PersistPetition {

        @Test
        @DisplayName("persist=true stores every line item, long cost heads included")
        void storesEveryLineItem() throws Exception {
            assertThat(LONG_HEAD.length()).isGreaterThan(50);
            String body = "{\"financial_year\": \"2024-25\", \"persist\": true, \"items\": ["
                    + itemJson("O&M", "Controllable", "SBU-D", "150", "120") + ", "
                    + itemJson(LONG_HEAD, "Controllable", "SBU-D", "90", "95") + "]}";

            mockMvc.perform(post("/api/truing-up/petition").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total_items_processed").value(2));

            // same inputs, same rule version: the stored rows are found under the recomputed checksums
            PetitionReport expected = truingUpService.processPetition("2024-25", List.of(
                    item("O&M", "Controllable", "SBU-D", "150.00", "120.00"),
                    item(LONG_HEAD, "Controllable", "SBU-D", "90", "95")), null);
            for (AuditResult line : expected.lineItems()) {
                assertThat(auditTrailRepository.findByChecksum(line.checksum())).isPresent();
            }
            assertThat(auditTrailRepository.findByChecksum(expected.lineItems().get(1).checksum()).orElseThrow()
                    .getCostHead()).isEqualTo(LONG_HEAD);
        }

        @Test
        @DisplayName("a cost head too long to store is a 400 and nothing is written")
        void overlongHeadRejected() throws Exception {
            long before = auditTrailRepository.count();
            String body = "{\"persist\": true, \"items\": ["
                    + itemJson("Employee_Cost", "Controllable", "SBU-G", "80", "70") + ", "
                    + itemJson("H".repeat(CostInput.MAX_HEAD_LENGTH + 1), "Controllable", "SBU-G", "90", "95") + "]}";

            mockMvc.perform(post("/api/truing-up/petition").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Invalid Cost Input"));

            assertThat(auditTrailRepository.count()).isEqualTo(before);
        }

        @Test
        @DisplayName("a line item that cannot be stored rolls back the whole petition")
        void allOrNothing() {
            PetitionReport report = truingUpService.processPetition("2025-26", List.of(
                    item("Power_Purchase", "Uncontrollable", "SBU-G", "4100", "4175"),
                    item("Interest_Finance", "Uncontrollable", "SBU-G", "310", "300")), null);
            List<AuditResult> lines = new ArrayList<>(report.lineItems());
            lines.set(1, lines.get(1).withChecksum(null));
            PetitionReport corrupt = new PetitionReport(report.engineVersion(), report.financialYear(),
                    report.timestamp(), report.totalItemsProcessed(), report.pendingExtractionItems(),
                    report.totalRevenueGap(), report.totalDisallowed(), report.totalPassedThrough(),
                    report.sbuSummaries(), lines, report.batchChecksum());
            long before = auditTrailRepository.count();

            assertThatThrownBy(() -> auditTrailService.recordAll(corrupt))
                    .isInstanceOf(DataAccessException.class);

            assertThat(auditTrailRepository.count()).isEqualTo(before);
            assertThat(auditTrailRepository.findByChecksum(report.lineItems().get(0).checksum())).isEmpty();
        }
    }
}
