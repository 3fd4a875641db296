package io.flowscan.analysis;

import java.util.Objects;

/**
 * A loop that matched one of the non-termination heuristics.
 *
 * @param kind        Pattern that matched
 * @param line        Line of the loop statement
 * @param description Human-readable explanation
 */
public record LoopSite(LoopKind kind, int line, String description) {
    public LoopSite {
        Objects.requireNonNull(kind, "kind");
        if (line < 1) {
            throw new IllegalArgumentException("Loop line must be positive, got " + line);
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Loop description cannot be null or blank");
        }
    }
}
