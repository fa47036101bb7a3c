package dumb.algebra;

import dumb.algebra.Term.Compound;
import dumb.algebra.Term.Lit;
import dumb.algebra.Term.Var;

import static dumb.algebra.Term.num;
import static dumb.algebra.util.Log.debug;
import static java.util.Objects.requireNonNull;

/**
 * Elementary antiderivatives by pattern. Never fails: anything without a matching rule comes
 * back wrapped in an {@link Op#INTEGRAL} node. Results are left unsimplified.
 */
public enum Integral {
    ;

    public static final int DEFAULT_BUDGET = 10;

    public static Term of(Term term, Var variable) {
        return of(term, variable, DEFAULT_BUDGET);
    }

    /**
     * @param budget maximum number of integration-by-parts steps for this call; products
     *               still pending once it is spent stay unresolved
     */
    public static Term of(Term term, Var variable, int budget) {
        requireNonNull(term);
        requireNonNull(variable);
        return integrate(term, variable, new int[]{budget});
    }

    /** Definite form: kept verbatim, no closed-form evaluation. */
    public static Term of(Term term, Var variable, Term lower, Term upper) {
        return Term.of(Op.INTEGRAL, term, variable, requireNonNull(lower), requireNonNull(upper));
    }

    public static Compound unresolved(Term term, Var variable) {
        return Term.of(Op.INTEGRAL, term, variable);
    }

    public static boolean isUnresolved(Term term) {
        return term instanceof Compound c && c.op == Op.INTEGRAL;
    }

    private static Term integrate(Term term, Var variable, int[] budget) {
        if (term instanceof Lit) return term.mul(variable);
        if (term instanceof Var v)
            return v.name().equals(variable.name()) ? num(0.5).mul(variable.pow(2)) : unresolved(term, variable);

        var c = (Compound) term;
        return switch (c.op) {
            case ADD -> integrate(c.arg(0), variable, budget).add(integrate(c.arg(1), variable, budget));
            case MUL -> product(c, variable, budget);
            case POW -> {
                if (c.arg(0) instanceof Var base && base.name().equals(variable.name())
                        && c.arg(1) instanceof Lit n && n.value() != -1) {
                    var m = n.value() + 1;
                    yield variable.pow(m).mul(num(1).div(m));
                }
                yield unresolved(term, variable);
            }
            default -> unresolved(term, variable);
        };
    }

    private static Term product(Compound c, Var variable, int[] budget) {
        var a = c.arg(0);
        var b = c.arg(1);
        var aLit = a instanceof Lit;
        var bLit = b instanceof Lit;
        if (aLit && !bLit) return a.mul(integrate(b, variable, budget));
        if (bLit && !aLit) return b.mul(integrate(a, variable, budget));
        if (aLit) return unresolved(c, variable);
        return byParts(c, variable, budget);
    }

    /** u = operand 0, dv = operand 1: u*v - integral(v*du). */
    private static Term byParts(Compound c, Var variable, int[] budget) {
        if (budget[0] <= 0) {
            debug("integrate: by-parts budget spent at " + c.text());
            return unresolved(c, variable);
        }
        budget[0]--;

        var u = c.arg(0);
        Term du;
        try {
            du = Derivative.of(u, variable);
        } catch (Derivative.DifferentiationException e) {
            debug("integrate: by-parts cannot differentiate u: " + e.getMessage());
            return unresolved(c, variable);
        }
        var v = integrate(c.arg(1), variable, budget);
        return u.mul(v).sub(integrate(v.mul(du), variable, budget));
    }
}
