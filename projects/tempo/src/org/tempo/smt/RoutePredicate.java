package org.tempo.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

/**
 * A time-independent property of a route.
 */
@FunctionalInterface
public interface RoutePredicate {

    BoolExpr apply(Encoder enc, Expr route);

}
