package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <p>A counterexample to a check. Every value is the text of the solver
 * model's value for the corresponding expression, so a state stays
 * valid after the solver context that produced it is closed.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = State.CHECK_VAR)
@JsonSubTypes({
        @JsonSubTypes.Type(value = BaseState.class, name = "BASE"),
        @JsonSubTypes.Type(value = InductiveState.class, name = "INDUCTIVE"),
        @JsonSubTypes.Type(value = SafetyState.class, name = "SAFETY"),
        @JsonSubTypes.Type(value = MonolithicState.class, name = "MONOLITHIC")})
public abstract class State {

    static final String CHECK_VAR = "check";

    static final String NODE_VAR = "node";

    static final String ROUTE_VAR = "route";

    static final String TIME_VAR = "time";

    static final String SYMBOLICS_VAR = "symbolics";

    private final SortedMap<String, String> _symbolics;

    protected State(SortedMap<String, String> symbolics) {
        _symbolics = symbolics == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(symbolics));
    }

    @JsonProperty(CHECK_VAR)
    public abstract SmtCheck getCheck();

    @JsonProperty(SYMBOLICS_VAR)
    public SortedMap<String, String> getSymbolics() {
        return _symbolics;
    }

    /**
     * A human-readable report of the counterexample.
     */
    public String prettyPrint() {
        StringBuilder sb = new StringBuilder();
        sb.append(describe()).append("\n");
        appendDetails(sb);
        if (!_symbolics.isEmpty()) {
            sb.append("symbolics:\n");
            _symbolics.forEach((var, val) -> sb.append("  ").append(var).append(" = ").append(val)
                    .append("\n"));
        }
        return sb.toString();
    }

    protected abstract String describe();

    protected abstract void appendDetails(StringBuilder sb);

    @Override
    public String toString() {
        return prettyPrint();
    }
}
