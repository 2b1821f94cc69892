package org.tempo.smt;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.tempo.common.TempoException;
import org.tempo.smt.networks.ShortestPath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tempo.smt.Lang.*;
import static org.tempo.smt.networks.ShortestPath.ROUTE_TYPE;

public class SimulatorTest {

    private static final Topology PATH = Topologies.path(3);

    @BeforeAll
    public static void setupLogging() {
        LoggerConfig.initialize();
    }

    private static RouteValue some(long length) {
        return enc -> ROUTE_TYPE.some(enc, enc.Int(length));
    }

    private static AnnotatedNetwork annotate(Network net, Map<String, TemporalPredicate> annotations) {
        return new AnnotatedNetwork(net, annotations,
                PATH.mapNodes(node -> IsSome(ROUTE_TYPE)), PATH.mapNodes(node -> True()), 2);
    }

    @Test
    public void routesSpreadOneHopPerRound() {
        Simulation simulation = Simulator.simulate(ShortestPath.network(PATH, "A"), 3);
        assertThat(simulation.getRounds()).hasSize(4);
        assertThat(simulation.getRoute(0, "A")).isEqualTo("(some 0)");
        assertThat(simulation.getRoute(0, "B")).isEqualTo("none");
        assertThat(simulation.getRoute(1, "B")).isEqualTo("(some 1)");
        assertThat(simulation.getRoute(1, "C")).isEqualTo("none");
        assertThat(simulation.getRoute(2, "C")).isEqualTo("(some 2)");
        assertThat(simulation.getRoute(3, "A")).isEqualTo("(some 0)");
    }

    @Test
    public void provedAnnotationsHoldInSimulation() {
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        annotations.put("A", Globally(Equals(some(0))));
        annotations.put("B", Until(1, IsNone(ROUTE_TYPE), Equals(some(1))));
        annotations.put("C", Until(2, IsNone(ROUTE_TYPE), Equals(some(2))));
        AnnotatedNetwork net = annotate(ShortestPath.network(PATH, "A"), annotations);

        assertThat(net.checkAnnotations()).isEmpty();
        assertThat(Simulator.checkAnnotations(net, 5)).isEmpty();
    }

    @Test
    public void provedAnnotationsHoldForEverySymbolicDestination() {
        Topology topology = Topologies.path(4);
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        for (String node : topology.getNodes()) {
            annotations.put(node, Globally(IfSome(ROUTE_TYPE, (enc, v) -> enc.Ge(v, enc.Int(0)))));
        }
        AnnotatedNetwork net = new AnnotatedNetwork(ShortestPath.symbolicDestination(topology),
                annotations, topology.mapNodes(node -> Globally(True())),
                topology.mapNodes(node -> True()));
        assertThat(net.checkAnnotations()).isEmpty();
        assertThat(Simulator.checkAnnotations(net, 5)).isEmpty();
    }

    @Test
    public void earlyAnnotationIsViolated() {
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        annotations.put("A", Globally(Equals(some(0))));
        annotations.put("B", Globally(IsSome(ROUTE_TYPE)));
        annotations.put("C", Globally(IsSome(ROUTE_TYPE)));
        AnnotatedNetwork net = annotate(ShortestPath.network(PATH, "A"), annotations);

        Optional<SimulationViolation> violation = Simulator.checkAnnotations(net, 5);
        assertThat(violation).isPresent();
        assertThat(violation.get().getNode()).isEqualTo("B");
        assertThat(violation.get().getTime()).isEqualTo(0);
        assertThat(violation.get().getRoute()).isEqualTo("none");
    }

    @Test
    public void unsatisfiableSymbolicsCannotBeSimulated() {
        SymbolicValue impossible = new SymbolicValue("x", IntType.INSTANCE,
                (enc, v) -> enc.False());
        Network net = ShortestPath.network(PATH, ShortestPath.network(PATH, "A").getInitialValues(),
                Collections.singletonList(impossible));
        assertThatThrownBy(() -> Simulator.simulate(net, 1)).isInstanceOf(TempoException.class);
        assertThatThrownBy(() -> Simulator.simulate(ShortestPath.network(PATH, "A"), -1))
                .isInstanceOf(TempoException.class);
    }
}
