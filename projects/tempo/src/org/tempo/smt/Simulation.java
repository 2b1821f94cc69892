package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * The routes of every node at every round of a synchronous simulation,
 * under one assignment of the symbolic values.
 */
public class Simulation {

    private static final String ROUNDS_VAR = "rounds";

    private static final String SYMBOLICS_VAR = "symbolics";

    private final List<Map<String, String>> _rounds;

    private final SortedMap<String, String> _symbolics;

    @JsonCreator
    public Simulation(
            @JsonProperty(ROUNDS_VAR) List<Map<String, String>> rounds,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        _rounds = Collections.unmodifiableList(new ArrayList<>(rounds));
        _symbolics = symbolics;
    }

    @JsonProperty(ROUNDS_VAR)
    public List<Map<String, String>> getRounds() {
        return _rounds;
    }

    @JsonProperty(SYMBOLICS_VAR)
    public SortedMap<String, String> getSymbolics() {
        return _symbolics;
    }

    /**
     * The route of a node at a round.
     */
    public String getRoute(int round, String node) {
        return _rounds.get(round).get(node);
    }
}
