package org.tempo.smt;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.TupleSort;

/**
 * A product of two types.
 */
public final class PairType implements SmtType {

    private final SmtType _first;

    private final SmtType _second;

    public PairType(SmtType first, SmtType second) {
        _first = first;
        _second = second;
    }

    public SmtType getFirst() {
        return _first;
    }

    public SmtType getSecond() {
        return _second;
    }

    @Override
    public String getName() {
        return "Pair<" + _first.getName() + "," + _second.getName() + ">";
    }

    @Override
    public Sort mkSort(Encoder enc) {
        Context ctx = enc.getCtx();
        Symbol[] fields = new Symbol[]{ctx.mkSymbol("first"), ctx.mkSymbol("second")};
        Sort[] sorts = new Sort[]{enc.getSort(_first), enc.getSort(_second)};
        return ctx.mkTupleSort(ctx.mkSymbol(getName()), fields, sorts);
    }

    private TupleSort sort(Encoder enc) {
        return (TupleSort) enc.getSort(this);
    }

    public Expr mk(Encoder enc, Expr first, Expr second) {
        return sort(enc).mkDecl().apply(first, second);
    }

    public Expr first(Encoder enc, Expr pair) {
        return sort(enc).getFieldDecls()[0].apply(pair);
    }

    public Expr second(Encoder enc, Expr pair) {
        return sort(enc).getFieldDecls()[1].apply(pair);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        PairType pairType = (PairType) o;

        if (!_first.equals(pairType._first)) return false;
        return _second.equals(pairType._second);
    }

    @Override
    public int hashCode() {
        int result = _first.hashCode();
        result = 31 * result + _second.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return getName();
    }
}
