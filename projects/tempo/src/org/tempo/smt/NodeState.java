package org.tempo.smt;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.SortedMap;

/**
 * A counterexample at a single node.
 */
public abstract class NodeState extends State {

    private final String _node;

    protected NodeState(String node, SortedMap<String, String> symbolics) {
        super(symbolics);
        _node = node;
    }

    @JsonProperty(NODE_VAR)
    public String getNode() {
        return _node;
    }

    @Override
    protected String describe() {
        return getCheck() + " check failed at node " + _node;
    }
}
