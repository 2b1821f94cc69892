package org.tempo.smt;

import com.microsoft.z3.BoolExpr;

@FunctionalInterface
public interface Condition {

    BoolExpr apply(Encoder enc);

}
