package org.tempo.smt;


import org.tempo.smt.answers.SmtStatsAnswerElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Runs checks and reports how long they took.
 */
public class Profile {

    private static final Logger LOGGER = Logger.getLogger(Profile.class.getName());

    private Profile() {}

    /**
     * Check the annotations of every node, timing each node's checks.
     */
    public static SmtStatsAnswerElement runAnnotatedWithStats(AnnotatedNetwork net) {
        Map<String, Long> times = new ConcurrentHashMap<>();
        Map<String, Optional<State>> results = net.checkAnnotationsWith((node, check) -> {
            long start = System.currentTimeMillis();
            Optional<State> result = check.get();
            times.put(node, System.currentTimeMillis() - start);
            return result;
        });

        Optional<State> counterexample = Optional.empty();
        List<Long> nodeTimes = new ArrayList<>();
        for (Map.Entry<String, Optional<State>> e : results.entrySet()) {
            nodeTimes.add(times.get(e.getKey()));
            if (!counterexample.isPresent()) {
                counterexample = e.getValue();
            }
        }

        Topology topology = net.getTopology();
        VerificationStats stats = VerificationStats.fromTimes(topology.getNodeCount(),
                topology.getEdgeCount(), nodeTimes);
        LOGGER.info("Modular checks " + (counterexample.isPresent() ? "failed" : "passed")
                + " (" + stats + ")");
        return new SmtStatsAnswerElement(VerificationResult.of(counterexample), stats);
    }

    /**
     * Run the monolithic check, timing it.
     */
    public static SmtStatsAnswerElement runMonolithicWithStats(AnnotatedNetwork net) {
        long start = System.currentTimeMillis();
        Optional<State> counterexample = net.checkMonolithic();
        long time = System.currentTimeMillis() - start;

        List<Long> times = new ArrayList<>();
        times.add(time);
        Topology topology = net.getTopology();
        VerificationStats stats = VerificationStats.fromTimes(topology.getNodeCount(),
                topology.getEdgeCount(), times);
        LOGGER.info("Monolithic check took " + time + "ms");
        return new SmtStatsAnswerElement(VerificationResult.of(counterexample), stats);
    }
}
