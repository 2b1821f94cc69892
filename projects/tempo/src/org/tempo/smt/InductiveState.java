package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Predecessor routes that satisfy their annotations at time t-1 but
 * merge into a route that violates the node's annotation at time t.
 */
public class InductiveState extends NodeState {

    private static final String NEIGHBOR_ROUTES_VAR = "neighborRoutes";

    private final String _route;

    private final Map<String, String> _neighborRoutes;

    private final String _time;

    @JsonCreator
    public InductiveState(
            @JsonProperty(NODE_VAR) String node,
            @JsonProperty(ROUTE_VAR) String route,
            @JsonProperty(NEIGHBOR_ROUTES_VAR) Map<String, String> neighborRoutes,
            @JsonProperty(TIME_VAR) String time,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        super(node, symbolics);
        _route = route;
        _neighborRoutes = neighborRoutes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(neighborRoutes));
        _time = time;
    }

    @Override
    public SmtCheck getCheck() {
        return SmtCheck.INDUCTIVE;
    }

    /**
     * The merged route at time t.
     */
    @JsonProperty(ROUTE_VAR)
    public String getRoute() {
        return _route;
    }

    /**
     * The predecessor routes at time t-1.
     */
    @JsonProperty(NEIGHBOR_ROUTES_VAR)
    public Map<String, String> getNeighborRoutes() {
        return _neighborRoutes;
    }

    @JsonProperty(TIME_VAR)
    public String getTime() {
        return _time;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        _neighborRoutes.forEach((neighbor, route) ->
                sb.append("route of ").append(neighbor).append(": ").append(route).append("\n"));
        sb.append("merged route: ").append(_route).append("\n");
        sb.append("time: ").append(_time).append("\n");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InductiveState that = (InductiveState) o;
        return Objects.equals(getNode(), that.getNode())
                && Objects.equals(_route, that._route)
                && _neighborRoutes.equals(that._neighborRoutes)
                && Objects.equals(_time, that._time)
                && getSymbolics().equals(that.getSymbolics());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNode(), _route, _neighborRoutes, _time, getSymbolics());
    }
}
