package org.tempo.smt;

import com.microsoft.z3.Expr;

/**
 * A transformation of a route, such as the transfer function of an edge.
 */
@FunctionalInterface
public interface RouteFunction {

    Expr apply(Encoder enc, Expr route);

}
