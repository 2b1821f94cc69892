package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.SortedMap;

/**
 * A simulated route that violates its node's annotation.
 */
public class SimulationViolation {

    private static final String NODE_VAR = "node";

    private static final String TIME_VAR = "time";

    private static final String ROUTE_VAR = "route";

    private static final String SYMBOLICS_VAR = "symbolics";

    private final String _node;

    private final int _time;

    private final String _route;

    private final SortedMap<String, String> _symbolics;

    @JsonCreator
    public SimulationViolation(
            @JsonProperty(NODE_VAR) String node,
            @JsonProperty(TIME_VAR) int time,
            @JsonProperty(ROUTE_VAR) String route,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        _node = node;
        _time = time;
        _route = route;
        _symbolics = symbolics;
    }

    @JsonProperty(NODE_VAR)
    public String getNode() {
        return _node;
    }

    @JsonProperty(TIME_VAR)
    public int getTime() {
        return _time;
    }

    @JsonProperty(ROUTE_VAR)
    public String getRoute() {
        return _route;
    }

    @JsonProperty(SYMBOLICS_VAR)
    public SortedMap<String, String> getSymbolics() {
        return _symbolics;
    }

    @Override
    public String toString() {
        return "annotation of " + _node + " violated at time " + _time + " by route " + _route
                + " with " + _symbolics;
    }
}
