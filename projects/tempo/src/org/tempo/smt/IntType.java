package org.tempo.smt;

import com.microsoft.z3.Sort;

/**
 * Unbounded mathematical integers.
 */
public final class IntType implements SmtType {

    public static final IntType INSTANCE = new IntType();

    private IntType() {}

    @Override
    public String getName() {
        return "Int";
    }

    @Override
    public Sort mkSort(Encoder enc) {
        return enc.getCtx().mkIntSort();
    }

    @Override
    public String toString() {
        return getName();
    }
}
