package org.tempo.smt.networks;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.tempo.smt.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tempo.smt.Lang.*;
import static org.tempo.smt.networks.Reachability.ROUTE_TYPE;

public class FaultToleranceTest {

    private static final Topology TOPOLOGY = Topologies.complete(3);

    private static final SymbolicFailures FAILURES = new SymbolicFailures(TOPOLOGY, 1);

    @BeforeAll
    public static void setupLogging() {
        LoggerConfig.initialize();
    }

    private static Network network() {
        return FaultTolerance.withFailures(Reachability.network(TOPOLOGY, "A"), FAILURES, ROUTE_TYPE::none);
    }

    private static AnnotatedNetwork annotated(Map<String, TemporalPredicate> annotations) {
        return new AnnotatedNetwork(network(), annotations,
                TOPOLOGY.mapNodes(node -> Finally(2, IsSome(ROUTE_TYPE))),
                TOPOLOGY.mapNodes(node -> IsSome(ROUTE_TYPE)));
    }

    /**
     * A node learns the route in one round, or in two when its link to A is down.
     */
    private static Map<String, TemporalPredicate> failureAwareAnnotations() {
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        annotations.put("A", Globally(IsSome(ROUTE_TYPE)));
        for (String node : new String[]{"B", "C"}) {
            TimeValue witness = If(enc -> FAILURES.isFailed(enc, "A", node), Time(2), Time(1));
            annotations.put(node, Finally(witness, IsSome(ROUTE_TYPE)));
        }
        return annotations;
    }

    @Test
    public void failureAwareAnnotationsAreProved() {
        AnnotatedNetwork net = annotated(failureAwareAnnotations());
        assertThat(net.checkAnnotations()).isEmpty();
        assertThat(net.checkMonolithic()).isEmpty();
    }

    @Test
    public void fixedBoundFailsInductively() {
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        annotations.put("A", Globally(IsSome(ROUTE_TYPE)));
        annotations.put("B", Finally(2, IsSome(ROUTE_TYPE)));
        annotations.put("C", Finally(2, IsSome(ROUTE_TYPE)));
        AnnotatedNetwork net = annotated(annotations);

        Optional<State> counterexample = net.checkAnnotations();
        assertThat(counterexample).isPresent();
        assertThat(counterexample.get().getCheck()).isEqualTo(SmtCheck.INDUCTIVE);
        InductiveState state = (InductiveState) counterexample.get();
        assertThat(state.getRoute()).isEqualTo("none");
        assertThat(state.getSymbolics())
                .containsEntry(SymbolicFailures.linkName("A", state.getNode()), "1")
                .containsEntry(SymbolicFailures.FAILED_LINKS, "1");
    }

    @Test
    public void failureVariablesCoverEveryLinkOnce() {
        assertThat(FAILURES.getSymbolics()).extracting(SymbolicValue::getName).containsExactly(
                "FAILED-LINK_A_B", "FAILED-LINK_A_C", "FAILED-LINK_B_C", SymbolicFailures.FAILED_LINKS);
        assertThat(SymbolicFailures.linkName("C", "A")).isEqualTo("FAILED-LINK_A_C");
    }

    @Test
    public void atMostOneLinkFails() {
        Simulation simulation = Simulator.simulate(network(), 2);
        int failed = 0;
        for (SymbolicValue sv : FAILURES.getSymbolics()) {
            if (!sv.getName().equals(SymbolicFailures.FAILED_LINKS)
                    && simulation.getSymbolics().get(sv.getName()).equals("1")) {
                failed++;
            }
        }
        assertThat(failed).isLessThanOrEqualTo(1);
        assertThat(simulation.getSymbolics().get(SymbolicFailures.FAILED_LINKS))
                .isEqualTo(String.valueOf(failed));
    }

    @Test
    public void failureAwareAnnotationsSurviveSimulation() {
        assertThat(Simulator.checkAnnotations(annotated(failureAwareAnnotations()), 5)).isEmpty();
    }

    @Test
    public void withoutFailuresOneRoundSuffices() {
        Map<String, TemporalPredicate> annotations = new LinkedHashMap<>();
        annotations.put("A", Globally(IsSome(ROUTE_TYPE)));
        annotations.put("B", Finally(1, IsSome(ROUTE_TYPE)));
        annotations.put("C", Finally(1, IsSome(ROUTE_TYPE)));
        AnnotatedNetwork net = new AnnotatedNetwork(Reachability.network(TOPOLOGY, "A"), annotations,
                TOPOLOGY.mapNodes(node -> Finally(2, IsSome(ROUTE_TYPE))),
                TOPOLOGY.mapNodes(node -> IsSome(ROUTE_TYPE)));
        assertThat(net.checkAnnotations()).isEmpty();
    }
}
