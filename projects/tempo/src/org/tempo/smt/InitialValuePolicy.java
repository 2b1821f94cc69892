package org.tempo.smt;

/**
 * How a node's initial value takes part in later rounds.
 */
public enum InitialValuePolicy {
    /** The initial value seeds the merge at every round. */
    PERSISTENT,
    /** The initial value is only the route at time 0. */
    FIRST_ROUND_ONLY
}
