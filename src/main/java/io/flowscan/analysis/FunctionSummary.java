package io.flowscan.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Analysis result for one function.
 * <p>
 * Everything except the termination status is fixed at construction. The interprocedural
 * fixpoint may flip {@link #terminates()} from {@code ALWAYS} to {@code MAY_DIVERGE} once,
 * recording the callee responsible; nothing ever flips it back.
 */
public final class FunctionSummary {

    private final String qualifiedName;
    private final String path;
    private final int line;
    private final SortedSet<Integer> unreachableLines;
    private final List<LoopSite> loopSites;
    private final int cyclomaticComplexity;
    private final List<String> localCallees;
    private final int blockCount;
    private final boolean analyzable;

    private Termination terminates;
    private String divergingCallee;

    private FunctionSummary(Builder builder) {
        if (builder.qualifiedName == null || builder.qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Qualified name cannot be null or blank");
        }
        this.qualifiedName = builder.qualifiedName;
        this.path = builder.path;
        this.line = builder.line;
        this.unreachableLines = Collections.unmodifiableSortedSet(new TreeSet<>(builder.unreachableLines));
        this.loopSites = List.copyOf(builder.loopSites);
        this.cyclomaticComplexity = builder.cyclomaticComplexity;
        this.localCallees = List.copyOf(builder.localCallees);
        this.blockCount = builder.blockCount;
        this.analyzable = builder.analyzable;
        this.terminates = loopSites.isEmpty() ? Termination.ALWAYS : Termination.MAY_DIVERGE;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * Path of the file the function was defined in; null when analyzed without one.
     */
    public String path() {
        return path;
    }

    public int line() {
        return line;
    }

    public SortedSet<Integer> unreachableLines() {
        return unreachableLines;
    }

    public List<LoopSite> loopSites() {
        return loopSites;
    }

    public int cyclomaticComplexity() {
        return cyclomaticComplexity;
    }

    public List<String> localCallees() {
        return localCallees;
    }

    public int blockCount() {
        return blockCount;
    }

    /**
     * False when the body could not be turned into a CFG and nothing was analyzed.
     */
    public boolean analyzable() {
        return analyzable;
    }

    public synchronized Termination terminates() {
        return terminates;
    }

    /**
     * Callee through which this function may diverge, or null when it diverges on its own
     * or always terminates.
     */
    public synchronized String divergingCallee() {
        return divergingCallee;
    }

    public boolean hasInfiniteLoop() {
        return !loopSites.isEmpty();
    }

    /**
     * Checks if the function may diverge only because of a callee.
     */
    public synchronized boolean callsDiverging() {
        return divergingCallee != null;
    }

    /**
     * Records that the function may diverge through {@code callee}. A function already
     * marked keeps its first callee.
     *
     * @return true if the status changed
     */
    public synchronized boolean markMayDiverge(String callee) {
        Objects.requireNonNull(callee, "callee");
        if (terminates == Termination.MAY_DIVERGE) {
            return false;
        }
        terminates = Termination.MAY_DIVERGE;
        divergingCallee = callee;
        return true;
    }

    @Override
    public synchronized String toString() {
        return "FunctionSummary[" + qualifiedName
                + ", unreachable=" + unreachableLines
                + ", loops=" + loopSites.size()
                + ", complexity=" + cyclomaticComplexity
                + ", callees=" + localCallees
                + ", terminates=" + terminates
                + (divergingCallee == null ? "" : ", via=" + divergingCallee)
                + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String qualifiedName;
        private String path;
        private int line;
        private final SortedSet<Integer> unreachableLines = new TreeSet<>();
        private final List<LoopSite> loopSites = new ArrayList<>();
        private int cyclomaticComplexity = 1;
        private final List<String> localCallees = new ArrayList<>();
        private int blockCount;
        private boolean analyzable = true;

        public Builder qualifiedName(String qualifiedName) {
            this.qualifiedName = qualifiedName;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder line(int line) {
            this.line = line;
            return this;
        }

        public Builder unreachableLines(Collection<Integer> lines) {
            this.unreachableLines.addAll(lines);
            return this;
        }

        public Builder loopSite(LoopSite site) {
            this.loopSites.add(site);
            return this;
        }

        public Builder loopSites(List<LoopSite> sites) {
            this.loopSites.addAll(sites);
            return this;
        }

        public Builder cyclomaticComplexity(int complexity) {
            this.cyclomaticComplexity = complexity;
            return this;
        }

        public Builder localCallee(String callee) {
            if (!localCallees.contains(callee)) {
                localCallees.add(callee);
            }
            return this;
        }

        public Builder localCallees(List<String> callees) {
            callees.forEach(this::localCallee);
            return this;
        }

        public Builder blockCount(int blockCount) {
            this.blockCount = blockCount;
            return this;
        }

        public Builder analyzable(boolean analyzable) {
            this.analyzable = analyzable;
            return this;
        }

        public FunctionSummary build() {
            return new FunctionSummary(this);
        }
    }
}
