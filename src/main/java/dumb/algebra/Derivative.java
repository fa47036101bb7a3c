package dumb.algebra;

import dumb.algebra.Term.Compound;
import dumb.algebra.Term.Lit;
import dumb.algebra.Term.Var;

import static dumb.algebra.Term.num;
import static java.util.Objects.requireNonNull;

/**
 * Symbolic differentiation by structural recursion. Results are never simplified here.
 */
public enum Derivative {
    ;

    public static Term of(Term term, Var variable) {
        requireNonNull(variable);
        if (term instanceof Lit) return num(0);
        if (term instanceof Var v) return num(v.name().equals(variable.name()) ? 1 : 0);

        var c = (Compound) term;
        if (c.op.trig()) return Trig.derivative(c, variable);
        return switch (c.op) {
            case ADD, SUB -> c.with(c.args.stream().map(a -> of(a, variable)).toList());
            case MUL -> {
                var u = c.arg(0);
                var v = c.arg(1);
                yield u.mul(of(v, variable)).add(v.mul(of(u, variable)));
            }
            case DIV -> {
                var u = c.arg(0);
                var v = c.arg(1);
                yield v.mul(of(u, variable)).sub(u.mul(of(v, variable))).div(v.pow(2));
            }
            case POW -> power(c, variable);
            case PI -> num(0);
            default -> throw new UnknownOperationException(c);
        };
    }

    /**
     * Applies {@link #of} {@code n} times, simplifying after every step so product and
     * quotient rules do not compound the tree size.
     */
    public static Term nth(Term term, Var variable, int n, int maxIterations) {
        var result = term;
        for (var i = 0; i < n; i++)
            result = Simplifier.simplify(of(result, variable), maxIterations);
        return result;
    }

    private static Term power(Compound c, Var variable) {
        var base = c.arg(0);
        var exponent = c.arg(1);
        if (exponent instanceof Lit n)
            return num(n.value()).mul(base.pow(n.value() - 1));
        if (base instanceof Lit a)
            return c.mul(num(Math.log(a.value())).mul(of(exponent, variable)));
        throw new UnsupportedDifferentiationException(c);
    }

    public static class DifferentiationException extends RuntimeException {
        public final Term term;

        DifferentiationException(String message, Term term) {
            super(message + ": " + term.text());
            this.term = term;
        }
    }

    /** Operator tag without a differentiation rule. */
    public static class UnknownOperationException extends DifferentiationException {
        UnknownOperationException(Compound term) {
            super("Unknown operation '" + term.op.symbol + "'", term);
        }
    }

    /** Power whose base and exponent are both non-literal. */
    public static class UnsupportedDifferentiationException extends DifferentiationException {
        UnsupportedDifferentiationException(Compound term) {
            super("General exponent differentiation not supported", term);
        }
    }
}
