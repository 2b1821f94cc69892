package org.tempo.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;

/**
 * <p>A named free variable of a network, such as an unknown destination
 * or an unknown link failure. Every query of the network is scoped by
 * the constraints of its symbolic values, so counterexamples only ever
 * assign legal values.</p>
 */
public class SymbolicValue {

    private final String _name;

    private final SmtType _type;

    private final SymbolicConstraint _constraint;

    public SymbolicValue(String name, SmtType type) {
        this(name, type, null);
    }

    public SymbolicValue(String name, SmtType type, SymbolicConstraint constraint) {
        _name = name;
        _type = type;
        _constraint = constraint;
    }

    public String getName() {
        return _name;
    }

    public SmtType getType() {
        return _type;
    }

    public boolean hasConstraint() {
        return _constraint != null;
    }

    /**
     * The variable of this value in the encoder's context.
     */
    public Expr getValue(Encoder enc) {
        return enc.getSymbolicValue(_name);
    }

    public BoolExpr equalsValue(Encoder enc, Expr e) {
        return enc.Eq(getValue(enc), e);
    }

    /**
     * The constraint instantiated for this value, or true if there is none.
     */
    public BoolExpr constraint(Encoder enc) {
        if (_constraint == null) {
            return enc.True();
        }
        return _constraint.apply(enc, getValue(enc));
    }

    @Override
    public String toString() {
        return _name + " : " + _type.getName();
    }
}
