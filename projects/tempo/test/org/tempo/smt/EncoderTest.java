package org.tempo.smt;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Model;
import org.junit.jupiter.api.Test;
import org.tempo.common.TempoException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EncoderTest {

    @Test
    public void symbolicConstraintsScopeEveryQuery() {
        SymbolicValue x = new SymbolicValue("x", IntType.INSTANCE,
                (enc, v) -> enc.And(enc.Ge(v, enc.Int(3)), enc.Le(v, enc.Int(3))));
        try (Encoder enc = new Encoder("scoped", Collections.singletonList(x), VerificationOptions.DEFAULT)) {
            Optional<Model> model = enc.solve();
            assertThat(model).isPresent();
            assertThat(enc.symbolicAssignment(model.get())).containsEntry("x", "3");
        }
    }

    @Test
    public void constraintsMayReferToOtherSymbolics() {
        List<SymbolicTime> times = SymbolicTime.ascending(3);
        assertThat(times).extracting(SymbolicValue::getName).containsExactly("tau-0", "tau-1", "tau-2");
        try (Encoder enc = new Encoder("times", times, VerificationOptions.DEFAULT)) {
            enc.add("late start", enc.Ge(times.get(0).getTime(enc), enc.Int(4)));
            Optional<Model> model = enc.solve();
            assertThat(model).isPresent();
            long t0 = Long.parseLong(enc.evaluate(model.get(), times.get(0).getTime(enc)));
            long t2 = Long.parseLong(enc.evaluate(model.get(), times.get(2).getTime(enc)));
            assertThat(t2).isGreaterThanOrEqualTo(t0 + 2);
        }
    }

    @Test
    public void negativeTimesAreUnsatisfiable() {
        SymbolicTime t = new SymbolicTime("t");
        try (Encoder enc = new Encoder("negative", Collections.singletonList(t), VerificationOptions.DEFAULT)) {
            enc.add("negative time", enc.Lt(t.getTime(enc), enc.Int(0)));
            assertThat(enc.solve()).isEmpty();
        }
    }

    @Test
    public void unsatCoreNamesConflictingConjuncts() {
        VerificationOptions options = VerificationOptions.DEFAULT.withTrackUnsatCore(true);
        try (Encoder enc = new Encoder("core", Collections.emptyList(), options)) {
            ArithExpr y = enc.freshTime("y");
            enc.add("y is large", enc.Gt(y, enc.Int(10)));
            enc.add("y is small", enc.Lt(y, enc.Int(0)));
            enc.add("irrelevant", enc.True());
            assertThat(enc.solve()).isEmpty();
            assertThat(enc.getLastUnsatCore()).contains("y is large", "y is small");
        }
    }

    @Test
    public void pushAndPopScopeAssertions() {
        try (Encoder enc = new Encoder("scopes", Collections.emptyList(), VerificationOptions.DEFAULT)) {
            ArithExpr y = enc.freshTime("y");
            enc.push();
            enc.add("false", enc.False());
            assertThat(enc.solve()).isEmpty();
            enc.pop();
            enc.add("y is 2", enc.Eq(y, enc.Int(2)));
            Optional<Model> model = enc.solve();
            assertThat(model).isPresent();
            assertThat(enc.evaluate(model.get(), y)).isEqualTo("2");
        }
    }

    @Test
    public void undeclaredSymbolicThrows() {
        try (Encoder enc = new Encoder("undeclared", Collections.emptyList(), VerificationOptions.DEFAULT)) {
            assertThatThrownBy(() -> enc.getSymbolicValue("missing"))
                    .isInstanceOf(TempoException.class)
                    .hasMessageContaining("missing");
        }
    }

    @Test
    public void duplicateSymbolicNamesThrow() {
        List<SymbolicValue> symbolics = Arrays.asList(
                new SymbolicValue("x", IntType.INSTANCE), new SymbolicValue("x", IntType.INSTANCE));
        assertThatThrownBy(() -> new Encoder("duplicate", symbolics, VerificationOptions.DEFAULT))
                .isInstanceOf(TempoException.class);
    }

    @Test
    public void freshVariablesNeverAliasSymbolics() {
        SymbolicValue x = new SymbolicValue("x", IntType.INSTANCE, (enc, v) -> enc.Eq(v, enc.Int(3)));
        try (Encoder enc = new Encoder("fresh", Collections.singletonList(x), VerificationOptions.DEFAULT)) {
            ArithExpr time = enc.freshTime("x");
            ArithExpr other = enc.freshTime("x");
            enc.add("time is 5", enc.Eq(time, enc.Int(5)));
            enc.add("other is 7", enc.Eq(other, enc.Int(7)));
            Optional<Model> model = enc.solve();
            assertThat(model).isPresent();
            assertThat(enc.symbolicAssignment(model.get())).containsEntry("x", "3");
            assertThat(enc.evaluate(model.get(), time)).isEqualTo("5");
        }
    }

    @Test
    public void comparisonsRejectMixedSorts() {
        try (Encoder enc = new Encoder("mixed", Collections.emptyList(), VerificationOptions.DEFAULT)) {
            assertThatThrownBy(() -> enc.Le(enc.True(), enc.Int(1)))
                    .isInstanceOf(TempoException.class);
        }
    }
}
