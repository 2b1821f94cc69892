package org.tempo.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

/**
 * Restricts the legal values of a {@link SymbolicValue}. The encoder
 * gives access to the other symbolic values of the network.
 */
@FunctionalInterface
public interface SymbolicConstraint {

    BoolExpr apply(Encoder enc, Expr value);

}
