package io.flowscan.scc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        dependencies.put("a", List.of("b"));
        dependencies.put("b", List.of("c"));
        dependencies.put("c", List.of("a"));
        dependencies.put("d", List.of("a"));
        graph = DependencyGraph.of(dependencies);
    }

    @Test
    void of_commitsImmediately() {
        assertThat(graph.hasPendingChanges()).isFalse();
        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.cycles(2)).containsExactly(List.of("a", "b", "c"));
        assertThat(graph.isInCycle("a")).isTrue();
        assertThat(graph.isInCycle("d")).isFalse();
        assertThat(graph.isInCycle("unknown")).isFalse();
    }

    @Test
    void newGraph_answersQueriesBeforeFirstCommit() {
        DependencyGraph fresh = new DependencyGraph();
        fresh.addDependency("x", "y");
        fresh.addDependency("y", "x");

        assertThat(fresh.hasPendingChanges()).isTrue();
        assertThat(fresh.cycles(2)).isEmpty();
        assertThat(fresh.isInCycle("x")).isFalse();
    }

    @Test
    void commit_emptyGraphHasNoCycles() {
        DependencyGraph empty = new DependencyGraph();

        assertThat(empty.hasPendingChanges()).isTrue();
        assertThat(empty.commit()).isEqualTo(UpdateResult.FULL_RECOMPUTE);
        assertThat(empty.hasPendingChanges()).isFalse();
        assertThat(empty.cycles(2)).isEmpty();
    }

    @Test
    void commit_breakingCycleUpdates() {
        graph.removeDependency("c", "a");

        assertThat(graph.hasPendingChanges()).isTrue();
        assertThat(graph.commit()).isEqualTo(UpdateResult.UPDATED);
        assertThat(graph.cycles(2)).isEmpty();
        assertThat(graph.verify()).isTrue();
    }

    @Test
    void commit_closingCycleRecomputes() {
        graph.addDependency("a", "d");

        assertThat(graph.commit()).isEqualTo(UpdateResult.FULL_RECOMPUTE);
        assertThat(graph.cycles(2)).containsExactly(List.of("a", "b", "c", "d"));
    }

    @Test
    void commit_withoutChangesIsNoChange() {
        assertThat(graph.commit()).isEqualTo(UpdateResult.NO_CHANGE);
    }

    @Test
    void addThenRemoveCancelsOut() {
        graph.addDependency("d", "b");
        graph.removeDependency("d", "b");

        assertThat(graph.hasPendingChanges()).isFalse();
        assertThat(graph.commit()).isEqualTo(UpdateResult.NO_CHANGE);
    }

    @Test
    void commit_newNodeReinitializes() {
        graph.addDependency("e", "d");

        assertThat(graph.hasPendingChanges()).isTrue();
        assertThat(graph.commit()).isEqualTo(UpdateResult.FULL_RECOMPUTE);
        assertThat(graph.nodeCount()).isEqualTo(5);
        assertThat(graph.nodeIndex("e")).contains(4);
        assertThat(graph.label(4)).isEqualTo("e");
    }

    @Test
    void removeDependency_unknownEdgeIsIgnored() {
        graph.removeDependency("a", "d");
        graph.removeDependency("x", "y");

        assertThat(graph.hasPendingChanges()).isFalse();
        assertThat(graph.nodeCount()).isEqualTo(4);
    }

    @Test
    void addNode_rejectsBlankLabel() {
        assertThatThrownBy(() -> graph.addNode(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void edits_keepCacheConsistent() {
        graph.removeDependency("b", "c");
        graph.addDependency("b", "d");
        graph.commit();
        graph.addDependency("d", "b");
        graph.addDependency("c", "b");
        graph.commit();

        assertThat(graph.verify()).isTrue();
        assertThat(graph.edges()).contains(new Edge(1, 3), new Edge(3, 1));
        assertThat(graph.cycles(2)).containsExactly(List.of("a", "b", "d"));
    }
}
