package org.tempo.smt;

/**
 * The kinds of query the engine discharges.
 */
public enum SmtCheck {
    BASE,
    INDUCTIVE,
    SAFETY,
    MONOLITHIC
}
