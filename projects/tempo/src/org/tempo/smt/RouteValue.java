package org.tempo.smt;

import com.microsoft.z3.Expr;

/**
 * A route built in a given encoder, e.g. the initial value of a node.
 */
@FunctionalInterface
public interface RouteValue {

    Expr apply(Encoder enc);

}
