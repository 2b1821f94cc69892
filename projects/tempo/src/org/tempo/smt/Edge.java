package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A directed edge along which routes propagate: the route held at
 * {@code from} is transferred to {@code to}.
 */
public class Edge implements Comparable<Edge> {

    private static final String FROM_VAR = "from";

    private static final String TO_VAR = "to";

    private final String _from;

    private final String _to;

    @JsonCreator
    public Edge(@JsonProperty(FROM_VAR) String from, @JsonProperty(TO_VAR) String to) {
        _from = from;
        _to = to;
    }

    @JsonProperty(FROM_VAR)
    public String getFrom() {
        return _from;
    }

    @JsonProperty(TO_VAR)
    public String getTo() {
        return _to;
    }

    public Edge reverse() {
        return new Edge(_to, _from);
    }

    @Override
    public int compareTo(Edge o) {
        int cmp = _from.compareTo(o._from);
        return (cmp != 0 ? cmp : _to.compareTo(o._to));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Edge edge = (Edge) o;

        if (_from != null ? !_from.equals(edge._from) : edge._from != null) return false;
        return _to != null ? _to.equals(edge._to) : edge._to == null;
    }

    @Override
    public int hashCode() {
        int result = _from != null ? _from.hashCode() : 0;
        result = 31 * result + (_to != null ? _to.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return _from + " --> " + _to;
    }

}
