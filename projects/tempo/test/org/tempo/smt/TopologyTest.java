package org.tempo.smt;

import org.junit.jupiter.api.Test;
import org.tempo.common.TempoException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TopologyTest {

    private static Topology triangle() {
        Map<String, List<String>> neighbors = new LinkedHashMap<>();
        neighbors.put("A", Arrays.asList("B", "C"));
        neighbors.put("B", Collections.singletonList("A"));
        neighbors.put("C", Collections.emptyList());
        return new Topology(neighbors);
    }

    @Test
    public void edgesFollowDeclarationOrder() {
        Topology topology = triangle();
        assertThat(topology.getNodes()).containsExactly("A", "B", "C");
        assertThat(topology.getEdges()).containsExactly(
                new Edge("B", "A"), new Edge("C", "A"), new Edge("A", "B"));
        assertThat(topology.getEdgeCount()).isEqualTo(3);
        assertThat(topology.getNodeCount()).isEqualTo(3);
    }

    @Test
    public void neighborsOfUnknownNodeThrow() {
        assertThatThrownBy(() -> triangle().getNeighbors("D"))
                .isInstanceOf(TempoException.class)
                .hasMessageContaining("D");
    }

    @Test
    public void undeclaredPredecessorIsRejected() {
        Map<String, List<String>> neighbors = new LinkedHashMap<>();
        neighbors.put("A", Collections.singletonList("Z"));
        assertThatThrownBy(() -> new Topology(neighbors))
                .isInstanceOf(TempoException.class)
                .hasMessageContaining("undeclared predecessor");
    }

    @Test
    public void duplicatePredecessorIsRejected() {
        Map<String, List<String>> neighbors = new LinkedHashMap<>();
        neighbors.put("A", Arrays.asList("B", "B"));
        neighbors.put("B", Collections.emptyList());
        assertThatThrownBy(() -> new Topology(neighbors))
                .isInstanceOf(TempoException.class);
    }

    @Test
    public void foldsAndFilters() {
        Topology topology = triangle();
        int degrees = topology.foldNodes(0, (acc, node) -> acc + topology.getNeighbors(node).size());
        assertThat(degrees).isEqualTo(topology.getEdgeCount());
        assertThat(topology.foldEdges(0, (acc, edge) -> acc + 1)).isEqualTo(3);
        assertThat(topology.filterEdges(e -> e.getTo().equals("A"))).hasSize(2);
        assertThat(topology.mapEdges(Edge::reverse).get(new Edge("A", "B")))
                .isEqualTo(new Edge("B", "A"));
        assertThat(topology.mapNodes(String::toLowerCase)).containsEntry("C", "c");
    }

    @Test
    public void parsesJson() {
        Topology topology = Topology.fromJson("{\"x\": [\"y\"], \"y\": [\"x\"], \"z\": []}");
        assertThat(topology.getNodes()).containsExactly("x", "y", "z");
        assertThat(topology.getNeighbors("x")).containsExactly("y");
        assertThat(topology.getNeighbors("z")).isEmpty();
    }

    @Test
    public void malformedJsonThrows() {
        assertThatThrownBy(() -> Topology.fromJson("{\"x\": "))
                .isInstanceOf(TempoException.class);
    }
}
