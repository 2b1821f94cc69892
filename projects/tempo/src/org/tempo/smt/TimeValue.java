package org.tempo.smt;

import com.microsoft.z3.ArithExpr;

/**
 * A logical time, either a constant or built from symbolic values.
 */
@FunctionalInterface
public interface TimeValue {

    ArithExpr apply(Encoder enc);

}
