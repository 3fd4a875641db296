package io.flowscan.scc;

/**
 * Directed edge between two node indices.
 */
public record Edge(int from, int to) {
    public Edge {
        if (from < 0 || to < 0) {
            throw new IndexOutOfBoundsException("Edge endpoints cannot be negative: (" + from + ", " + to + ")");
        }
    }

    public static Edge of(int from, int to) {
        return new Edge(from, to);
    }

    /**
     * Fails if an endpoint is not a node of a graph with {@code nodeCount} nodes.
     */
    public void checkBounds(int nodeCount) {
        if (from >= nodeCount || to >= nodeCount) {
            throw new IndexOutOfBoundsException(
                    "Edge (" + from + ", " + to + ") references node outside [0, " + nodeCount + ")");
        }
    }

    public boolean isSelfLoop() {
        return from == to;
    }

    @Override
    public String toString() {
        return "(" + from + " -> " + to + ")";
    }
}
