package com.example.truingup.service;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.AuditVerification;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.engine.exception.AuditRecordNotFoundException;
import com.example.truingup.entity.AuditTrail;
import com.example.truingup.repository.AuditTrailRepository;
import com.example.truingup.util.ChecksumUtils;
import com.example.truingup.util.HashUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/*
 * Append-only persistence of audit results.
 *  - key: checksum (unique). Same checksum = same computation, the stored row is returned as is.
 *  - no update path exists; all columns are updatable=false.
 *  - a petition is recorded in one transaction: every line item or none.
 *  - result_json keeps the full record so verify() can recompute the digest later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrailService {

    private final AuditTrailRepository auditTrailRepository;

    public AuditTrail record(AuditResult result) {
        Optional<AuditTrail> existing = auditTrailRepository.findByChecksum(result.checksum());
        if (existing.isPresent()) {
            log.info("[audit] already recorded checksum={}", result.checksum());
            return existing.get();
        }
        try {
            AuditTrail saved = auditTrailRepository.save(toEntity(result));
            log.info("[audit] recorded id={} checksum={} head={} sbu={}",
                    saved.getAuditId(), saved.getChecksum(), saved.getCostHead(), saved.getSbuCode());
            return saved;
        } catch (DataIntegrityViolationException e) {
            // concurrent writer stored the same computation first
            return auditTrailRepository.findByChecksum(result.checksum()).orElseThrow(() -> e);
        }
    }

    @Transactional
    public List<AuditTrail> recordAll(PetitionReport report) {
        List<AuditTrail> rows = new ArrayList<>(report.lineItems().size());
        for (AuditResult item : report.lineItems()) {
            rows.add(record(item));
        }
        return rows;
    }

    @Transactional(readOnly = true)
    public AuditTrail findByChecksum(String checksum) {
        return auditTrailRepository.findByChecksum(checksum)
                .orElseThrow(() -> new AuditRecordNotFoundException(checksum));
    }

    @Transactional(readOnly = true)
    public AuditVerification verify(String checksum) {
        AuditTrail row = findByChecksum(checksum);
        String recomputed = ChecksumUtils.computeChecksumOfJson(row.getResultJson());
        boolean intact = HashUtils.digestsMatch(row.getChecksum(), recomputed);
        if (!intact) {
            log.error("[audit] checksum mismatch id={} stored={} recomputed={}", row.getAuditId(), checksum, recomputed);
        }
        return new AuditVerification(row.getChecksum(), recomputed, intact, row.getEngineVersion());
    }

    private AuditTrail toEntity(AuditResult r) {
        return AuditTrail.builder()
                .checksum(r.checksum())
                .computedAt(r.timestamp())
                .sbuCode(r.sbuCode().getLabel())
                .scenarioLabel(r.scenario())
                .costHead(r.costHead())
                .varianceCategory(r.varianceCategory().getLabel())
                .approvedAmount(r.approvedAmount())
                .actualAmount(r.actualAmount())
                .varianceAmount(r.varianceAmount())
                .disallowedVariance(r.disallowedVariance())
                .passedThroughVariance(r.passedThroughVariance())
                .disallowanceReason(r.disallowanceReason())
                .regulatoryClause(r.regulatoryReference().clause())
                .engineVersion(r.metadata().engineVersion())
                .flags(String.join(",", r.metadata().flags()))
                .resultJson(ChecksumUtils.toJson(r))
                .build();
    }
}
