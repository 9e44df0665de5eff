package com.example.truingup.api;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.AuditVerification;
import com.example.truingup.dto.CostInputRequest;
import com.example.truingup.dto.FormulaDtos.LineLossEfficiency;
import com.example.truingup.dto.FormulaDtos.NormativeInterest;
import com.example.truingup.dto.FormulaDtos.OmEscalation;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.dto.PetitionRequest;
import com.example.truingup.dto.RuleSetListing;
import com.example.truingup.dto.ScenarioDtos.DeltaReport;
import com.example.truingup.dto.ScenarioDtos.Snapshot;
import com.example.truingup.dto.ScenarioRequest;
import com.example.truingup.service.AuditTrailService;
import com.example.truingup.service.ScenarioSnapshotService;
import com.example.truingup.service.TruingUpService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * /api/truing-up endpoints
 *  - POST /variance              : one cost head  (?version=..., ?persist=true to append to the audit trail)
 *  - POST /petition              : all heads of a petition, fail-fast
 *  - GET  /om-escalation         : normative O&M escalation
 *  - GET  /normative-interest    : interest on an outstanding loan
 *  - GET  /line-loss             : actual line loss vs trajectory target
 *  - GET  /td-loss-target        : trajectory lookup
 *  - GET  /rule-sets             : registered versions + active one
 *  - POST /scenarios, GET /scenarios/compare
 *  - GET  /audit/{checksum}, GET /audit/{checksum}/verify
 *
 * Every numeric figure comes from the engine; nothing here does arithmetic.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/truing-up")
public class TruingUpApiController {

    private final TruingUpService truingUpService;
    private final AuditTrailService auditTrailService;
    private final ScenarioSnapshotService scenarioSnapshotService;

    @PostMapping("/variance")
    public ResponseEntity<AuditResult> computeVariance(
            @RequestBody CostInputRequest request,
            @RequestParam(required = false) String version,
            @RequestParam(required = false, defaultValue = "false") boolean persist
    ) {
        AuditResult result = truingUpService.computeVariance(request.toCostInput(), version);
        if (persist) auditTrailService.record(result);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/petition")
    public ResponseEntity<PetitionReport> processPetition(@RequestBody PetitionRequest request) {
        PetitionReport report = truingUpService.processPetition(
                request.getFinancialYear(), request.toCostInputs(), request.getRuleVersion());
        if (request.isPersist()) auditTrailService.recordAll(report);
        return ResponseEntity.ok(report);
    }

    @GetMapping("/om-escalation")
    public ResponseEntity<OmEscalation> escalateOm(
            @RequestParam BigDecimal baseOm,
            @RequestParam BigDecimal cpiChange,
            @RequestParam BigDecimal wpiChange,
            @RequestParam(required = false) String version
    ) {
        return ResponseEntity.ok(truingUpService.escalateOm(baseOm, cpiChange, wpiChange, version));
    }

    @GetMapping("/normative-interest")
    public ResponseEntity<NormativeInterest> normativeInterest(
            @RequestParam BigDecimal outstandingLoan,
            @RequestParam(required = false) String version
    ) {
        return ResponseEntity.ok(truingUpService.normativeInterest(outstandingLoan, version));
    }

    @GetMapping("/line-loss")
    public ResponseEntity<LineLossEfficiency> lineLoss(
            @RequestParam String financialYear,
            @RequestParam BigDecimal actualLossPercent,
            @RequestParam(required = false) String version
    ) {
        return ResponseEntity.ok(truingUpService.lineLossEfficiency(financialYear, actualLossPercent, version));
    }

    @GetMapping("/td-loss-target")
    public ResponseEntity<Map<String, Object>> tdLossTarget(
            @RequestParam String financialYear,
            @RequestParam(required = false) String version
    ) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("financial_year", financialYear);
        body.put("td_loss_target", truingUpService.tdLossTarget(financialYear, version));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/rule-sets")
    public ResponseEntity<RuleSetListing> ruleSets() {
        return ResponseEntity.ok(truingUpService.ruleSets());
    }

    @PostMapping("/scenarios")
    public ResponseEntity<Snapshot> createScenario(@RequestBody ScenarioRequest request) {
        return ResponseEntity.ok(scenarioSnapshotService.createSnapshot(
                request.getId(), request.getLabel(), request.getCreatedBy(), request.toCostInputs()));
    }

    @GetMapping("/scenarios/compare")
    public ResponseEntity<DeltaReport> compareScenarios(@RequestParam String a, @RequestParam String b) {
        return ResponseEntity.ok(scenarioSnapshotService.compare(a, b));
    }

    /** Stored record exactly as written. */
    @GetMapping(value = "/audit/{checksum}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> auditRecord(@PathVariable String checksum) {
        return ResponseEntity.ok(auditTrailService.findByChecksum(checksum).getResultJson());
    }

    @GetMapping("/audit/{checksum}/verify")
    public ResponseEntity<AuditVerification> verifyAuditRecord(@PathVariable String checksum) {
        return ResponseEntity.ok(auditTrailService.verify(checksum));
    }
}
