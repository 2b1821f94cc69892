package org.tempo.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.tempo.smt.Lang.*;

public class LangTest {

    private static final OptionType OPT_INT = new OptionType(IntType.INSTANCE);

    /**
     * True when the formula holds for every value of its free variables.
     */
    private static boolean valid(Function<Encoder, BoolExpr> formula) {
        try (Encoder enc = new Encoder("valid", Collections.emptyList(), VerificationOptions.DEFAULT)) {
            enc.add("negated formula", enc.Not(formula.apply(enc)));
            return !enc.solve().isPresent();
        }
    }

    @Test
    public void finallyHoldsBeforeThreshold() {
        TemporalPredicate p = Finally(3, IsSome(OPT_INT));
        assertThat(valid(enc -> p.apply(enc, OPT_INT.none(enc), enc.Int(2)))).isTrue();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.none(enc), enc.Int(3)))).isFalse();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(7)), enc.Int(3)))).isTrue();
    }

    @Test
    public void untilSwitchesAtThreshold() {
        TemporalPredicate p = Until(1, IsNone(OPT_INT), Equals(enc -> OPT_INT.some(enc, enc.Int(1))));
        assertThat(valid(enc -> p.apply(enc, OPT_INT.none(enc), enc.Int(0)))).isTrue();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(1)), enc.Int(0)))).isFalse();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(1)), enc.Int(1)))).isTrue();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(2)), enc.Int(5)))).isFalse();
    }

    @Test
    public void globallyAndNeverIgnoreTime() {
        assertThat(valid(enc -> {
            ArithExpr t = enc.freshTime("t");
            Expr r = enc.freshRoute("r", OPT_INT);
            return enc.Eq(Globally(IsSome(OPT_INT)).apply(enc, r, t),
                    enc.Not(Never(IsSome(OPT_INT)).apply(enc, r, t)));
        })).isTrue();
    }

    @Test
    public void intersectIsConjunction() {
        TemporalPredicate p = Intersect(Globally(IsSome(OPT_INT)), Finally(2, IfSome(OPT_INT,
                (enc, v) -> enc.Le(v, enc.Int(4)))));
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(4)), enc.Int(9)))).isTrue();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(5)), enc.Int(9)))).isFalse();
        assertThat(valid(enc -> p.apply(enc, OPT_INT.some(enc, enc.Int(5)), enc.Int(1)))).isTrue();
        assertThat(valid(enc -> Intersect().apply(enc, OPT_INT.none(enc), enc.Int(0)))).isTrue();
    }

    @Test
    public void routeFunctions() {
        assertThat(valid(enc -> enc.Eq(
                Omap(OPT_INT, Incr(2)).apply(enc, OPT_INT.some(enc, enc.Int(3))),
                OPT_INT.some(enc, enc.Int(5))))).isTrue();
        assertThat(valid(enc -> enc.Eq(
                Omap(OPT_INT, Incr(2)).apply(enc, OPT_INT.none(enc)),
                OPT_INT.none(enc)))).isTrue();
        assertThat(valid(enc -> {
            Expr r = enc.freshRoute("r", OPT_INT);
            return enc.Eq(Identity().apply(enc, r), r);
        })).isTrue();
    }

    @Test
    public void symbolicThresholds() {
        assertThat(valid(enc -> {
            BoolExpr b = enc.getCtx().mkBoolConst("b");
            TimeValue t = If(e -> b, Time(2), Time(1));
            TemporalPredicate p = Finally(t, IsSome(OPT_INT));
            // at time 1 the route may only be absent when b holds
            return enc.Implies(enc.Not(p.apply(enc, OPT_INT.none(enc), enc.Int(1))), enc.Not(b));
        })).isTrue();
    }

    @Test
    public void routePredicates() {
        assertThat(valid(enc -> True().apply(enc, OPT_INT.none(enc)))).isTrue();
        assertThat(valid(enc -> Not(True()).apply(enc, OPT_INT.none(enc)))).isFalse();
        assertThat(valid(enc -> And(IsSome(OPT_INT), Not(IsNone(OPT_INT)))
                .apply(enc, OPT_INT.some(enc, enc.Int(0))))).isTrue();
        assertThat(valid(enc -> IfSome(OPT_INT, (e, v) -> e.False()).apply(enc, OPT_INT.none(enc))))
                .isTrue();
    }
}
