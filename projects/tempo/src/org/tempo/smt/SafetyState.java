package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.SortedMap;

/**
 * A route and time that satisfy a node's annotation but not its property.
 */
public class SafetyState extends NodeState {

    private final String _route;

    private final String _time;

    @JsonCreator
    public SafetyState(
            @JsonProperty(NODE_VAR) String node,
            @JsonProperty(ROUTE_VAR) String route,
            @JsonProperty(TIME_VAR) String time,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        super(node, symbolics);
        _route = route;
        _time = time;
    }

    @Override
    public SmtCheck getCheck() {
        return SmtCheck.SAFETY;
    }

    @JsonProperty(ROUTE_VAR)
    public String getRoute() {
        return _route;
    }

    @JsonProperty(TIME_VAR)
    public String getTime() {
        return _time;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        sb.append("route: ").append(_route).append("\n");
        sb.append("time: ").append(_time).append("\n");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SafetyState that = (SafetyState) o;
        return Objects.equals(getNode(), that.getNode())
                && Objects.equals(_route, that._route)
                && Objects.equals(_time, that._time)
                && getSymbolics().equals(that.getSymbolics());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNode(), _route, _time, getSymbolics());
    }
}
