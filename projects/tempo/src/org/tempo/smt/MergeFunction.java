package org.tempo.smt;

import com.microsoft.z3.Expr;

/**
 * <p>Combines two routes into the preferred one.</p>
 *
 * <p>The engine assumes, without checking, that a merge function is
 * associative and commutative and selects the better of its arguments
 * under some route order. {@link MergeChecker} can be used to confirm
 * this for a given network.</p>
 */
@FunctionalInterface
public interface MergeFunction {

    Expr apply(Encoder enc, Expr r1, Expr r2);

}
