package com.example.truingup.service;

import com.example.truingup.dto.AuditResult;
import com.example.truingup.dto.FormulaDtos.LineLossEfficiency;
import com.example.truingup.dto.FormulaDtos.NormativeInterest;
import com.example.truingup.dto.FormulaDtos.OmEscalation;
import com.example.truingup.dto.PetitionReport;
import com.example.truingup.dto.RuleSetListing;
import com.example.truingup.engine.CostInput;
import com.example.truingup.engine.PetitionProcessor;
import com.example.truingup.engine.RegulatoryConstants;
import com.example.truingup.engine.RuleEngine;
import com.example.truingup.engine.RuleSetRegistry;
import com.example.truingup.engine.exception.HumanVerificationRequiredException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Entry point for callers. Resolves the rule version once per call (the requested one, or the
 * active one) and hands that instance to a fresh {@link RuleEngine}; the computation never looks
 * at the registry again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TruingUpService {

    private final RuleSetRegistry ruleSetRegistry;

    public AuditResult computeVariance(CostInput input, String version) {
        RuleEngine engine = engineFor(version);
        try {
            return engine.computeVariance(input);
        } catch (HumanVerificationRequiredException e) {
            log.warn("[truing-up] verification gate blocked '{}' ({}) under {}",
                    e.getCostHead(), input.sbuCode().getLabel(), engine.getVersion());
            throw e;
        }
    }

    public PetitionReport processPetition(String financialYear, List<CostInput> inputs, String version) {
        RuleEngine engine = engineFor(version);
        try {
            return new PetitionProcessor(engine).processPetition(financialYear, inputs);
        } catch (HumanVerificationRequiredException e) {
            log.warn("[truing-up] petition fy={} aborted: '{}' is not human-verified ({} items submitted)",
                    financialYear, e.getCostHead(), inputs.size());
            throw e;
        }
    }

    public OmEscalation escalateOm(BigDecimal baseOm, BigDecimal cpiChange, BigDecimal wpiChange, String version) {
        return engineFor(version).computeOmEscalation(baseOm, cpiChange, wpiChange);
    }

    public NormativeInterest normativeInterest(BigDecimal outstandingLoan, String version) {
        return engineFor(version).computeNormativeInterest(outstandingLoan);
    }

    public LineLossEfficiency lineLossEfficiency(String financialYear, BigDecimal actualLossPercent, String version) {
        return engineFor(version).computeLineLossEfficiency(financialYear, actualLossPercent);
    }

    public BigDecimal tdLossTarget(String financialYear, String version) {
        return ruleSetRegistry.resolve(version).getTdLossTarget(financialYear);
    }

    public RuleSetListing ruleSets() {
        List<RegulatoryConstants> all = ruleSetRegistry.versions().stream().map(ruleSetRegistry::get).toList();
        return new RuleSetListing(ruleSetRegistry.active().getVersion(), all);
    }

    private RuleEngine engineFor(String version) {
        return new RuleEngine(ruleSetRegistry.resolve(version));
    }
}
