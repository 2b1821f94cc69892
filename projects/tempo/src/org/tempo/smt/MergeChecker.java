package org.tempo.smt;


import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Checks the algebraic properties the annotation checks expect of a
 * network's merge function. The checks are never run automatically.
 */
public class MergeChecker {

    private static final Logger LOGGER = Logger.getLogger(MergeChecker.class.getName());

    public enum Property {
        COMMUTATIVE,
        ASSOCIATIVE,
        IDEMPOTENT
    }

    private MergeChecker() {}

    /**
     * @return The properties that the merge function violates, in declaration order
     */
    public static List<Property> check(Network net) {
        List<Property> violated = new ArrayList<>();
        for (Property p : Property.values()) {
            if (!holds(net, p)) {
                violated.add(p);
            }
        }
        return violated;
    }

    public static boolean holds(Network net, Property property) {
        MergeFunction merge = net.getMergeFunction();
        SmtType type = net.getRouteType();
        try (Encoder enc = net.newEncoder(property + " merge check")) {
            Expr a = enc.freshRoute("a", type);
            Expr b = enc.freshRoute("b", type);
            Expr c = enc.freshRoute("c", type);
            BoolExpr law;
            switch (property) {
            case COMMUTATIVE:
                law = enc.Eq(merge.apply(enc, a, b), merge.apply(enc, b, a));
                break;
            case ASSOCIATIVE:
                law = enc.Eq(merge.apply(enc, merge.apply(enc, a, b), c),
                        merge.apply(enc, a, merge.apply(enc, b, c)));
                break;
            case IDEMPOTENT:
                law = enc.Eq(merge.apply(enc, a, a), a);
                break;
            default:
                throw new IllegalStateException("Unknown merge property " + property);
            }
            enc.add("negated " + property.name().toLowerCase(Locale.ROOT), enc.Not(law));
            Optional<Model> model = enc.solve();
            if (model.isPresent()) {
                Model m = model.get();
                LOGGER.info("Merge is not " + property.name().toLowerCase(Locale.ROOT) + ": a = "
                        + enc.evaluate(m, a) + ", b = " + enc.evaluate(m, b) + ", c = "
                        + enc.evaluate(m, c));
                return false;
            }
            return true;
        }
    }
}
