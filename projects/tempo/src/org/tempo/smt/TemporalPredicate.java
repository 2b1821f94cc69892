package org.tempo.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

/**
 * A property of a route at a given logical time. Annotations and
 * modular properties are temporal predicates.
 */
@FunctionalInterface
public interface TemporalPredicate {

    BoolExpr apply(Encoder enc, Expr route, ArithExpr time);

}
