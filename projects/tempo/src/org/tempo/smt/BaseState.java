package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.SortedMap;

/**
 * The initial value of a node that violates its annotation at time 0.
 */
public class BaseState extends NodeState {

    private final String _route;

    @JsonCreator
    public BaseState(
            @JsonProperty(NODE_VAR) String node,
            @JsonProperty(ROUTE_VAR) String route,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        super(node, symbolics);
        _route = route;
    }

    @Override
    public SmtCheck getCheck() {
        return SmtCheck.BASE;
    }

    @JsonProperty(ROUTE_VAR)
    public String getRoute() {
        return _route;
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        sb.append("initial route: ").append(_route).append("\n");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BaseState that = (BaseState) o;
        return Objects.equals(getNode(), that.getNode())
                && Objects.equals(_route, that._route)
                && getSymbolics().equals(that.getSymbolics());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getNode(), _route, getSymbolics());
    }
}
