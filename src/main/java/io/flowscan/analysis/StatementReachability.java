package io.flowscan.analysis;

import io.flowscan.ast.Stmt;
import io.flowscan.cfg.BasicBlock;
import io.flowscan.cfg.ControlFlowGraph;

import java.util.BitSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reachability of individual statements, derived from a CFG walk.
 * Statements are tracked by identity, since two statements may be equal as values.
 */
public final class StatementReachability {

    private final Map<Stmt, Integer> blockOf = new IdentityHashMap<>();
    private final BitSet reachable;
    private final ControlFlowGraph cfg;

    public StatementReachability(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.reachable = cfg.reachableBlocks();
        for (BasicBlock block : cfg.blocks()) {
            for (Stmt stmt : block.statements()) {
                blockOf.put(stmt, block.id());
            }
        }
    }

    /**
     * Checks if control can reach the statement. Statements the graph does not hold, such
     * as the bodies of nested definitions, count as unreachable.
     */
    public boolean isReachable(Stmt stmt) {
        Integer block = blockOf.get(stmt);
        return block != null && reachable.get(block);
    }

    /**
     * Lines held only by blocks the entry never reaches. A line that also appears in a
     * reachable block is left out.
     */
    public SortedSet<Integer> unreachableLines() {
        SortedSet<Integer> dead = new TreeSet<>();
        SortedSet<Integer> live = new TreeSet<>();
        for (BasicBlock block : cfg.blocks()) {
            SortedSet<Integer> target = reachable.get(block.id()) ? live : dead;
            target.addAll(block.lines());
        }
        dead.removeAll(live);
        return dead;
    }
}
