package org.tempo.smt;


import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds labelled assertions to a solver. When tracking is enabled every
 * assertion is guarded by a fresh literal so that the labels of the
 * assertions used to refute a query can be recovered.
 */
public class UnsatCore {

    private final boolean _doTrack;

    private final Map<String, String> _trackingLabels;

    private int _trackingNum;

    public UnsatCore(boolean doTrack) {
        _doTrack = doTrack;
        _trackingLabels = new HashMap<>();
        _trackingNum = 0;
    }

    public void track(Solver solver, Context ctx, String label, BoolExpr be) {
        String name = "Pred" + _trackingNum;
        _trackingNum = _trackingNum + 1;
        _trackingLabels.put(name, label);
        if (_doTrack) {
            solver.assertAndTrack(be, ctx.mkBoolConst(name));
        } else {
            solver.add(be);
        }
    }

    /**
     * The labels of the assertions in the solver's last unsat core.
     * Empty when tracking is off.
     */
    public List<String> getCore(Solver solver) {
        List<String> labels = new ArrayList<>();
        if (!_doTrack) {
            return labels;
        }
        for (BoolExpr be : solver.getUnsatCore()) {
            String label = _trackingLabels.get(be.toString());
            if (label != null) {
                labels.add(label);
            }
        }
        return labels;
    }

    public boolean isTracking() {
        return _doTrack;
    }
}
