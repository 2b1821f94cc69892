package org.tempo.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import org.tempo.common.TempoException;

/**
 * <p>An optional value of an inner type, encoded as a datatype with
 * the constructors {@code none} and {@code some(value)}.</p>
 *
 * <p>Options are the usual route type: {@code none} means that a node
 * has no route yet.</p>
 */
public final class OptionType implements SmtType {

    private static final int NONE = 0;

    private static final int SOME = 1;

    private final SmtType _inner;

    public OptionType(SmtType inner) {
        _inner = inner;
    }

    public SmtType getInner() {
        return _inner;
    }

    @Override
    public String getName() {
        return "Option<" + _inner.getName() + ">";
    }

    @Override
    public Sort mkSort(Encoder enc) {
        Context ctx = enc.getCtx();
        Sort inner = enc.getSort(_inner);
        Constructor none = ctx.mkConstructor("none", "is-none", null, null, null);
        Constructor some = ctx.mkConstructor("some", "is-some", new String[]{"value"},
                new Sort[]{inner}, null);
        return ctx.mkDatatypeSort(getName(), new Constructor[]{none, some});
    }

    private DatatypeSort sort(Encoder enc) {
        return (DatatypeSort) enc.getSort(this);
    }

    public Expr none(Encoder enc) {
        return sort(enc).getConstructors()[NONE].apply();
    }

    public Expr some(Encoder enc, Expr value) {
        return sort(enc).getConstructors()[SOME].apply(value);
    }

    public BoolExpr isNone(Encoder enc, Expr route) {
        return (BoolExpr) sort(enc).getRecognizers()[NONE].apply(route);
    }

    public BoolExpr isSome(Encoder enc, Expr route) {
        return (BoolExpr) sort(enc).getRecognizers()[SOME].apply(route);
    }

    /**
     * The payload of a route; unconstrained when the route is {@code none}.
     */
    public Expr getValue(Encoder enc, Expr route) {
        return sort(enc).getAccessors()[SOME][0].apply(route);
    }

    /**
     * Apply a function to the payload, leaving {@code none} unchanged.
     */
    public Expr map(Encoder enc, Expr route, RouteFunction f) {
        return enc.If(isSome(enc, route), some(enc, f.apply(enc, getValue(enc, route))), none(enc));
    }

    /**
     * True when the route is {@code none} or its payload satisfies the predicate.
     */
    public BoolExpr ifSome(Encoder enc, Expr route, RoutePredicate p) {
        return enc.Implies(isSome(enc, route), p.apply(enc, getValue(enc, route)));
    }

    /**
     * Prefer a route over no route, and the smaller of two integer payloads.
     */
    public Expr min(Encoder enc, Expr r1, Expr r2) {
        if (_inner != IntType.INSTANCE) {
            throw new TempoException("min is only defined for Option<Int>, not " + getName());
        }
        ArithExpr v1 = (ArithExpr) getValue(enc, r1);
        ArithExpr v2 = (ArithExpr) getValue(enc, r2);
        return enc.If(isNone(enc, r1), r2,
                enc.If(isNone(enc, r2), r1,
                        enc.If(enc.Le(v1, v2), r1, r2)));
    }

    /**
     * Prefer the first route that is present.
     */
    public Expr orElse(Encoder enc, Expr r1, Expr r2) {
        return enc.If(isSome(enc, r1), r1, r2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return _inner.equals(((OptionType) o)._inner);
    }

    @Override
    public int hashCode() {
        return 31 * _inner.hashCode() + 7;
    }

    @Override
    public String toString() {
        return getName();
    }
}
