package com.example.truingup.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Write-once row per computed audit result. The checksum is unique: a second insert of the same
 * computation is answered with the existing row, rows are never updated.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Entity
@Table(name = "audit_trail", indexes = {
        @Index(name = "ix_audit_sbu_head", columnList = "sbu_code, cost_head")
})
public class AuditTrail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "audit_id")
    private Long auditId;

    @Column(name = "checksum", length = 64, nullable = false, unique = true, updatable = false)
    private String checksum;

    @Column(name = "computed_at", nullable = false, updatable = false)
    private Instant computedAt;

    @Column(name = "sbu_code", length = 10, nullable = false, updatable = false)
    private String sbuCode;

    @Column(name = "scenario_label", length = 150, nullable = false, updatable = false)
    private String scenarioLabel;

    @Column(name = "cost_head", length = 100, nullable = false, updatable = false)
    private String costHead;

    @Column(name = "variance_category", length = 20, nullable = false, updatable = false)
    private String varianceCategory;

    @Column(name = "approved_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal approvedAmount;

    @Column(name = "actual_amount", precision = 19, scale = 2, updatable = false)
    private BigDecimal actualAmount;

    @Column(name = "variance_amount", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal varianceAmount;

    @Column(name = "disallowed_variance", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal disallowedVariance;

    @Column(name = "passed_through_variance", nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal passedThroughVariance;

    @Column(name = "disallowance_reason", length = 1000, updatable = false)
    private String disallowanceReason;

    @Column(name = "regulatory_clause", length = 200, nullable = false, updatable = false)
    private String regulatoryClause;

    @Column(name = "engine_version", length = 50, nullable = false, updatable = false)
    private String engineVersion;

    @Column(name = "flags", length = 255, updatable = false)
    private String flags;

    // full AuditResult as JSON, the source for re-verification
    @Lob
    @Column(name = "result_json", nullable = false, updatable = false)
    private String resultJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
