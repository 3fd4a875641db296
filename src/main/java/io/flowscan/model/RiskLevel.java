package io.flowscan.model;

/**
 * Severity of a finding.
 */
public enum RiskLevel {
    /**
     * Certain to hang or break the program.
     */
    CRITICAL(1, "CRITICAL"),

    /**
     * Likely to hang: loops without an exit, dependency cycles.
     */
    HIGH(2, "HIGH"),

    /**
     * Dead code, or divergence inherited from a callee.
     */
    MEDIUM(3, "MEDIUM"),

    /**
     * Maintainability concerns such as moderate complexity.
     */
    LOW(4, "LOW"),

    INFO(5, "INFO");

    private final int severity;
    private final String label;

    RiskLevel(int severity, String label) {
        this.severity = severity;
        this.label = label;
    }

    public int severity() {
        return severity;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this risk level is at least as severe as the given threshold.
     */
    public boolean isAtLeast(RiskLevel threshold) {
        return this.severity <= threshold.severity;
    }
}
