package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;

/**
 * A stable assignment of routes to every node that violates some
 * node's property.
 */
public class MonolithicState extends State {

    private static final String ROUTES_VAR = "routes";

    private final Map<String, String> _routes;

    @JsonCreator
    public MonolithicState(
            @JsonProperty(ROUTES_VAR) Map<String, String> routes,
            @JsonProperty(SYMBOLICS_VAR) SortedMap<String, String> symbolics) {
        super(symbolics);
        _routes = routes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    }

    @Override
    public SmtCheck getCheck() {
        return SmtCheck.MONOLITHIC;
    }

    @JsonProperty(ROUTES_VAR)
    public Map<String, String> getRoutes() {
        return _routes;
    }

    @Override
    protected String describe() {
        return "MONOLITHIC check failed";
    }

    @Override
    protected void appendDetails(StringBuilder sb) {
        _routes.forEach((node, route) ->
                sb.append("route of ").append(node).append(": ").append(route).append("\n"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MonolithicState that = (MonolithicState) o;
        return _routes.equals(that._routes) && getSymbolics().equals(that.getSymbolics());
    }

    @Override
    public int hashCode() {
        return 31 * _routes.hashCode() + getSymbolics().hashCode();
    }
}
