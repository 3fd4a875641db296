package io.flowscan.cfg;

import io.flowscan.ast.Stmt;

import java.util.List;

/**
 * Straight-line run of statements inside one function's control-flow graph.
 *
 * @param id         Index of the block in its graph
 * @param statements Statements in execution order; compound statements appear in the block
 *                   that evaluates their header
 * @param terminator How control leaves the block
 * @param successors Ids of successor blocks, in edge creation order
 */
public record BasicBlock(
        int id,
        List<Stmt> statements,
        Terminator terminator,
        List<Integer> successors
) {
    public BasicBlock {
        if (id < 0) {
            throw new IllegalArgumentException("Block id cannot be negative");
        }
        statements = statements == null ? List.of() : List.copyOf(statements);
        successors = successors == null ? List.of() : List.copyOf(successors);
        if (terminator == null) {
            terminator = successors.isEmpty() ? Terminator.NONE : Terminator.FALLTHROUGH;
        }
    }

    /**
     * Source lines of the statements in this block, in order.
     */
    public List<Integer> lines() {
        return statements.stream()
                .map(Stmt::line)
                .toList();
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
