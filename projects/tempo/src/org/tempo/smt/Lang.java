package org.tempo.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;

/**
 * <p>Combinators for building annotations and properties.</p>
 *
 * <p>Temporal combinators lift a time-independent route predicate to a
 * {@link TemporalPredicate}. Thresholds are {@link TimeValue}s, so they
 * may be constants or built from symbolic values, e.g.
 * {@code Finally(If(failed, Time(2), Time(1)), IsSome(type))}.</p>
 */
public class Lang {

    private Lang() {}

    /*
     * Temporal predicates
     */

    /**
     * The predicate holds at every time.
     */
    public static TemporalPredicate Globally(RoutePredicate p) {
        return (enc, r, t) -> p.apply(enc, r);
    }

    /**
     * The predicate holds from time {@code t0} on.
     */
    public static TemporalPredicate Finally(TimeValue t0, RoutePredicate p) {
        return (enc, r, t) -> enc.Or(enc.Lt(t, t0.apply(enc)), p.apply(enc, r));
    }

    public static TemporalPredicate Finally(long t0, RoutePredicate p) {
        return Finally(Time(t0), p);
    }

    /**
     * {@code before} holds strictly before time {@code t0}, and {@code after}
     * holds from time {@code t0} on.
     */
    public static TemporalPredicate Until(TimeValue t0, RoutePredicate before, RoutePredicate after) {
        return (enc, r, t) -> {
            ArithExpr threshold = t0.apply(enc);
            return enc.Or(
                    enc.And(enc.Lt(t, threshold), before.apply(enc, r)),
                    enc.And(enc.Ge(t, threshold), after.apply(enc, r)));
        };
    }

    public static TemporalPredicate Until(long t0, RoutePredicate before, RoutePredicate after) {
        return Until(Time(t0), before, after);
    }

    public static TemporalPredicate Never(RoutePredicate p) {
        return Globally(Not(p));
    }

    public static TemporalPredicate Intersect(TemporalPredicate... ps) {
        return (enc, r, t) -> {
            BoolExpr acc = enc.True();
            for (TemporalPredicate p : ps) {
                acc = enc.And(acc, p.apply(enc, r, t));
            }
            return acc;
        };
    }

    /*
     * Route predicates
     */

    public static RoutePredicate True() {
        return (enc, r) -> enc.True();
    }

    public static RoutePredicate Not(RoutePredicate p) {
        return (enc, r) -> enc.Not(p.apply(enc, r));
    }

    public static RoutePredicate And(RoutePredicate... ps) {
        return (enc, r) -> {
            BoolExpr acc = enc.True();
            for (RoutePredicate p : ps) {
                acc = enc.And(acc, p.apply(enc, r));
            }
            return acc;
        };
    }

    public static RoutePredicate Equals(RouteValue v) {
        return (enc, r) -> enc.Eq(r, v.apply(enc));
    }

    public static RoutePredicate IsSome(OptionType type) {
        return (enc, r) -> type.isSome(enc, r);
    }

    public static RoutePredicate IsNone(OptionType type) {
        return (enc, r) -> type.isNone(enc, r);
    }

    /**
     * The route is {@code none} or its payload satisfies the predicate.
     */
    public static RoutePredicate IfSome(OptionType type, RoutePredicate p) {
        return (enc, r) -> type.ifSome(enc, r, p);
    }

    /*
     * Route functions
     */

    public static RouteFunction Identity() {
        return (enc, r) -> r;
    }

    public static RouteFunction Incr(long n) {
        return (enc, r) -> enc.Sum((ArithExpr) r, enc.Int(n));
    }

    public static RouteFunction Omap(OptionType type, RouteFunction f) {
        return (enc, r) -> type.map(enc, r, f);
    }

    /*
     * Times
     */

    public static TimeValue Time(long t) {
        return enc -> enc.Int(t);
    }

    public static TimeValue If(Condition cond, TimeValue t1, TimeValue t2) {
        return enc -> enc.If(cond.apply(enc), t1.apply(enc), t2.apply(enc));
    }
}
