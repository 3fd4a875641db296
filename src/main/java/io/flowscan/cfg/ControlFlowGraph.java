package io.flowscan.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Control-flow graph of one function body.
 * <p>
 * Blocks are addressed by index. The graph has one entry block and one implicit exit block
 * that every {@code return} and {@code raise} reaches; functions that fall off their end
 * also edge to it. Instances are immutable once built.
 * <p>
 * An empty graph (no blocks at all) means the body could not be analyzed.
 */
public final class ControlFlowGraph {

    private static final ControlFlowGraph EMPTY = new ControlFlowGraph(List.of(), -1, -1);

    private final List<BasicBlock> blocks;
    private final int entry;
    private final int exit;
    private final List<List<Integer>> predecessors;

    ControlFlowGraph(List<BasicBlock> blocks, int entry, int exit) {
        this.blocks = List.copyOf(blocks);
        this.entry = entry;
        this.exit = exit;
        for (int i = 0; i < this.blocks.size(); i++) {
            if (this.blocks.get(i).id() != i) {
                throw new IllegalArgumentException("Block at index " + i + " has id " + this.blocks.get(i).id());
            }
        }
        List<List<Integer>> preds = new ArrayList<>(this.blocks.size());
        for (int i = 0; i < this.blocks.size(); i++) {
            preds.add(new ArrayList<>());
        }
        for (BasicBlock block : this.blocks) {
            for (int succ : block.successors()) {
                preds.get(succ).add(block.id());
            }
        }
        this.predecessors = preds.stream().map(List::copyOf).toList();
    }

    /**
     * Graph for a body that could not be analyzed.
     */
    public static ControlFlowGraph empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public List<BasicBlock> blocks() {
        return blocks;
    }

    public BasicBlock block(int id) {
        return blocks.get(id);
    }

    public int blockCount() {
        return blocks.size();
    }

    public int entry() {
        return entry;
    }

    public int exit() {
        return exit;
    }

    public List<Integer> successors(int id) {
        return blocks.get(id).successors();
    }

    public List<Integer> predecessors(int id) {
        return predecessors.get(id);
    }

    /**
     * Blocks that hand control to the implicit exit.
     */
    public List<Integer> exitBlocks() {
        return isEmpty() ? List.of() : predecessors(exit);
    }

    /**
     * Forward walk from the entry block along successor edges.
     *
     * @return bit set of reachable block ids; empty for an empty graph
     */
    public BitSet reachableBlocks() {
        BitSet visited = new BitSet(blocks.size());
        if (isEmpty()) {
            return visited;
        }
        Deque<Integer> work = new ArrayDeque<>();
        work.push(entry);
        visited.set(entry);
        while (!work.isEmpty()) {
            int id = work.pop();
            for (int succ : blocks.get(id).successors()) {
                if (!visited.get(succ)) {
                    visited.set(succ);
                    work.push(succ);
                }
            }
        }
        return visited;
    }

    public int edgeCount() {
        return blocks.stream().mapToInt(b -> b.successors().size()).sum();
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "ControlFlowGraph[empty]";
        }
        StringBuilder sb = new StringBuilder("ControlFlowGraph[entry=").append(entry)
                .append(", exit=").append(exit).append("]\n");
        for (BasicBlock block : blocks) {
            sb.append("  B").append(block.id())
                    .append(' ').append(block.lines())
                    .append(' ').append(block.terminator())
                    .append(" -> ").append(block.successors())
                    .append('\n');
        }
        return sb.toString();
    }
}
