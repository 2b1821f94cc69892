package org.tempo.smt;


import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * <p>Symbolic link failures of a topology. Every undirected link gets an
 * integer variable that is 1 when the link is down and 0 otherwise, and
 * a count variable bounds the number of simultaneous failures.</p>
 *
 * <p>A failed link drops routes in both directions.</p>
 */
public class SymbolicFailures {

    public static final String FAILED_LINKS = "FAILED-LINKS";

    private static final String FAILED_LINK_PREFIX = "FAILED-LINK_";

    private final int _maxFailures;

    private final Map<String, SymbolicValue> _failedLinks;

    private final SymbolicValue _failedCount;

    /**
     * Declare the failure variables of a topology.
     * @param topology  The topology whose links may fail
     * @param maxFailures  The maximum number of simultaneously failed links
     */
    public SymbolicFailures(Topology topology, int maxFailures) {
        _maxFailures = maxFailures;
        _failedLinks = new TreeMap<>();
        for (Edge edge : topology.getEdges()) {
            String name = linkName(edge.getFrom(), edge.getTo());
            if (!_failedLinks.containsKey(name)) {
                _failedLinks.put(name, new SymbolicValue(name, IntType.INSTANCE,
                        (enc, x) -> enc.And(enc.Ge(x, enc.Int(0)), enc.Le(x, enc.Int(1)))));
            }
        }
        List<String> linkNames = new ArrayList<>(_failedLinks.keySet());
        long bound = Math.min(maxFailures, linkNames.size());
        _failedCount = new SymbolicValue(FAILED_LINKS, IntType.INSTANCE, (enc, count) -> {
            ArithExpr sum = enc.Int(0);
            for (String name : linkNames) {
                sum = enc.Sum(sum, (ArithExpr) enc.getSymbolicValue(name));
            }
            return enc.And(enc.Eq(count, sum), enc.Le(count, enc.Int(bound)));
        });
    }

    /**
     * The name of the variable of the link between two nodes,
     * independent of the direction.
     */
    public static String linkName(String a, String b) {
        if (a.compareTo(b) <= 0) {
            return FAILED_LINK_PREFIX + a + "_" + b;
        }
        return FAILED_LINK_PREFIX + b + "_" + a;
    }

    public int getMaxFailures() {
        return _maxFailures;
    }

    /**
     * The link variables, ordered by name, followed by the count variable.
     */
    public List<SymbolicValue> getSymbolics() {
        List<SymbolicValue> symbolics = new ArrayList<>(_failedLinks.values());
        symbolics.add(_failedCount);
        return Collections.unmodifiableList(symbolics);
    }

    public ArithExpr getFailedVariable(Encoder enc, String a, String b) {
        SymbolicValue sv = _failedLinks.get(linkName(a, b));
        if (sv == null) {
            return enc.Int(0);
        }
        return (ArithExpr) sv.getValue(enc);
    }

    /**
     * True when the link between the two nodes is down. Nodes that are
     * not adjacent have no link that can fail.
     */
    public BoolExpr isFailed(Encoder enc, String a, String b) {
        return enc.Eq(getFailedVariable(enc, a, b), enc.Int(1));
    }

    /**
     * A transfer function along the edge that delivers {@code dropped}
     * instead of the transferred route when the link is down.
     */
    public RouteFunction asTransfer(Edge edge, RouteFunction f, RouteValue dropped) {
        return (enc, route) -> enc.If(isFailed(enc, edge.getFrom(), edge.getTo()),
                dropped.apply(enc), f.apply(enc, route));
    }
}
