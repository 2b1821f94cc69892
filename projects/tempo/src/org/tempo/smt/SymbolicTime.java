package org.tempo.smt;

import com.microsoft.z3.ArithExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * A symbolic logical time. Times are never negative, and a time built
 * from a previous one is strictly later.
 */
public class SymbolicTime extends SymbolicValue {

    public SymbolicTime(String name) {
        super(name, IntType.INSTANCE, (enc, t) -> enc.Ge(t, enc.Int(0)));
    }

    public SymbolicTime(String name, SymbolicTime previous) {
        super(name, IntType.INSTANCE, (enc, t) -> enc.And(
                enc.Ge(t, enc.Int(0)),
                enc.Gt(t, previous.getValue(enc))));
    }

    /**
     * The time as an arithmetic term, usable as a {@link TimeValue}.
     */
    public ArithExpr getTime(Encoder enc) {
        return (ArithExpr) getValue(enc);
    }

    /**
     * Times tau-0 &lt; tau-1 &lt; ... &lt; tau-(n-1).
     */
    public static List<SymbolicTime> ascending(int numTimes) {
        List<SymbolicTime> times = new ArrayList<>();
        for (int i = 0; i < numTimes; i++) {
            String name = "tau-" + i;
            if (i == 0) {
                times.add(new SymbolicTime(name));
            } else {
                times.add(new SymbolicTime(name, times.get(i - 1)));
            }
        }
        return times;
    }
}
