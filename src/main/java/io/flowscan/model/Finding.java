package io.flowscan.model;

import java.util.List;

/**
 * A single control-flow or dependency finding.
 *
 * @param detectorId     ID of the detector that reported it
 * @param riskLevel      Severity of the finding
 * @param pattern        Short name of the pattern detected, e.g. {@code while_true}
 * @param sourceFile     File the finding belongs to (null for graph-wide findings)
 * @param function       Qualified name of the function involved (null for graph-wide findings)
 * @param lineNumber     Primary line, or -1
 * @param affectedLines  All lines involved, sorted
 * @param description    Human-readable description of the finding
 * @param recommendation Recommended action to address the finding
 * @param details        Additional details, such as the members of a cycle
 */
public record Finding(
        String detectorId,
        RiskLevel riskLevel,
        String pattern,
        String sourceFile,
        String function,
        int lineNumber,
        List<Integer> affectedLines,
        String description,
        String recommendation,
        String details
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (detectorId == null || detectorId.isBlank()) {
            throw new IllegalArgumentException("detectorId cannot be null or blank");
        }
        if (riskLevel == null) {
            throw new IllegalArgumentException("riskLevel cannot be null");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern cannot be null or blank");
        }
        affectedLines = affectedLines == null ? List.of() : List.copyOf(affectedLines);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String detectorId;
        private RiskLevel riskLevel;
        private String pattern;
        private String sourceFile;
        private String function;
        private int lineNumber = -1;
        private List<Integer> affectedLines = List.of();
        private String description;
        private String recommendation;
        private String details;

        public Builder detectorId(String detectorId) {
            this.detectorId = detectorId;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder affectedLines(List<Integer> lines) {
            this.affectedLines = lines != null ? List.copyOf(lines) : List.of();
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Finding build() {
            return new Finding(
                    detectorId,
                    riskLevel,
                    pattern,
                    sourceFile,
                    function,
                    lineNumber,
                    affectedLines,
                    description,
                    recommendation,
                    details
            );
        }
    }

    /**
     * Returns a display-friendly location string.
     */
    public String location() {
        String base = sourceFile != null ? sourceFile : (function != null ? function : "<graph>");
        if (lineNumber > 0) {
            return base + ":" + lineNumber;
        }
        return base;
    }

    /**
     * Returns the function name without its qualifying scopes.
     */
    public String simpleFunctionName() {
        if (function == null) {
            return null;
        }
        int lastDot = function.lastIndexOf('.');
        return lastDot >= 0 ? function.substring(lastDot + 1) : function;
    }
}
