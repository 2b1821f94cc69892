package org.tempo.smt;


import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import org.tempo.common.TempoException;

import java.util.*;
import java.util.logging.Logger;

/**
 * <p>Bounded synchronous simulation of a network. Round 0 holds the
 * initial values, and at every later round each node takes the update
 * of the routes of the previous round.</p>
 *
 * <p>Routes are computed as terms over the symbolic values, so one
 * simulation covers every assignment the constraints allow. This makes
 * the simulator a cross-check of the annotation checks: annotations
 * that pass must hold at every simulated round.</p>
 */
public class Simulator {

    private static final Logger LOGGER = Logger.getLogger(Simulator.class.getName());

    private Simulator() {}

    private static List<Map<String, Expr>> computeRounds(Network net, Encoder enc, int rounds) {
        if (rounds < 0) {
            throw new TempoException("The number of rounds must not be negative, got " + rounds);
        }
        Topology topology = net.getTopology();
        List<Map<String, Expr>> result = new ArrayList<>();
        result.add(topology.mapNodes(node -> net.getInitialValues().get(node).apply(enc)));
        for (int t = 1; t <= rounds; t++) {
            Map<String, Expr> previous = result.get(t - 1);
            result.add(topology.mapNodes(node -> net.update(enc, node, previous).simplify()));
        }
        return result;
    }

    /**
     * Simulate rounds 0 to {@code rounds} under one assignment of the
     * symbolic values that satisfies their constraints.
     */
    public static Simulation simulate(Network net, int rounds) {
        try (Encoder enc = net.newEncoder("Simulation")) {
            List<Map<String, Expr>> routes = computeRounds(net, enc, rounds);
            Optional<Model> model = enc.solve();
            if (!model.isPresent()) {
                throw new TempoException("The symbolic constraints of the network are unsatisfiable");
            }
            Model m = model.get();
            List<Map<String, String>> values = new ArrayList<>();
            for (Map<String, Expr> round : routes) {
                Map<String, String> rendered = new LinkedHashMap<>();
                round.forEach((node, r) -> rendered.put(node, enc.evaluate(m, r)));
                values.add(rendered);
            }
            return new Simulation(values, enc.symbolicAssignment(m));
        }
    }

    /**
     * Look for a round up to {@code rounds} and an assignment of the
     * symbolic values at which some node's route violates its annotation.
     * @return The first violation, by round and then node order
     */
    public static Optional<SimulationViolation> checkAnnotations(AnnotatedNetwork net, int rounds) {
        try (Encoder enc = net.newEncoder("Simulated annotation check")) {
            List<Map<String, Expr>> routes = computeRounds(net, enc, rounds);
            for (int t = 0; t <= rounds; t++) {
                for (String node : net.getTopology().getNodes()) {
                    Expr route = routes.get(t).get(node);
                    enc.push();
                    enc.add("negated annotation of " + node + " at " + t,
                            enc.Not(net.getAnnotations().get(node).apply(enc, route, enc.Int(t))));
                    Optional<Model> model = enc.solve();
                    Optional<SimulationViolation> violation = Optional.empty();
                    if (model.isPresent()) {
                        Model m = model.get();
                        violation = Optional.of(new SimulationViolation(node, t, enc.evaluate(m, route),
                                enc.symbolicAssignment(m)));
                    }
                    enc.pop();
                    if (violation.isPresent()) {
                        LOGGER.info(violation.get().toString());
                        return violation;
                    }
                }
            }
            LOGGER.fine("No annotation violated in " + rounds + " rounds");
            return Optional.empty();
        }
    }
}
