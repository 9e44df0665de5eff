package com.example.truingup.engine;

/** Clauses the engine cites. {@link #citation()} goes verbatim into filings. */
public enum RegulatoryClause {
    PENDING_ACTUALS("Regulation 9.1", "Truing-Up Pending Actuals"),
    GAINS_SHARING("Regulation 9.2", "Controllable Gains Sharing"),
    LOSS_DISALLOWANCE("Regulation 9.3", "Controllable Loss Disallowance"),
    PASS_THROUGH("Regulation 9.4", "Uncontrollable Pass-Through"),
    OM_ESCALATION("Regulation 5.1", "O&M Escalation (CPI:WPI)"),
    NORMATIVE_INTEREST("Regulation 6.3", "Normative Interest (SBI EBLR + spread)"),
    TD_LOSS_TRAJECTORY("Regulation 7.1", "T&D Loss Trajectory");

    private final String clauseId;
    private final String title;

    RegulatoryClause(String clauseId, String title) {
        this.clauseId = clauseId;
        this.title = title;
    }

    public String getClauseId() {
        return clauseId;
    }

    public String getTitle() {
        return title;
    }

    public String citation() {
        return clauseId + ": " + title;
    }
}
