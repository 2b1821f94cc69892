package org.tempo.smt;

import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;

/**
 * A type with the single value {@code unit}.
 */
public final class UnitType implements SmtType {

    public static final UnitType INSTANCE = new UnitType();

    private UnitType() {}

    @Override
    public String getName() {
        return "Unit";
    }

    @Override
    public Sort mkSort(Encoder enc) {
        Context ctx = enc.getCtx();
        Constructor unit = ctx.mkConstructor("unit", "is-unit", null, null, null);
        return ctx.mkDatatypeSort(getName(), new Constructor[]{unit});
    }

    public Expr value(Encoder enc) {
        DatatypeSort sort = (DatatypeSort) enc.getSort(this);
        return sort.getConstructors()[0].apply();
    }

    @Override
    public String toString() {
        return getName();
    }
}
