package io.flowscan.analysis;

/**
 * Non-termination pattern a loop matched.
 */
public enum LoopKind {
    WHILE_TRUE("while_true", "Add a break condition or use a bounded loop"),
    WHILE_ONE("while_one", "Replace 'while 1' with an explicit condition or add a break"),
    CYCLE_ITERATOR("cycle_iterator", "Iterate over a finite sequence or break out of the unbounded iterator"),
    UNMODIFIED_CONDITION("unmodified_condition", "Update a condition variable inside the loop body or add a break");

    private final String label;
    private final String fixSuggestion;

    LoopKind(String label, String fixSuggestion) {
        this.label = label;
        this.fixSuggestion = fixSuggestion;
    }

    /**
     * Snake-case label used in reports.
     */
    public String label() {
        return label;
    }

    public String fixSuggestion() {
        return fixSuggestion;
    }
}
