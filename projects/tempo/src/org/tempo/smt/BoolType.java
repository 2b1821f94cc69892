package org.tempo.smt;

import com.microsoft.z3.Sort;

public final class BoolType implements SmtType {

    public static final BoolType INSTANCE = new BoolType();

    private BoolType() {}

    @Override
    public String getName() {
        return "Bool";
    }

    @Override
    public Sort mkSort(Encoder enc) {
        return enc.getCtx().mkBoolSort();
    }

    @Override
    public String toString() {
        return getName();
    }
}
