package dumb.algebra;

import dumb.algebra.Term.Compound;
import dumb.algebra.Term.Lit;
import dumb.algebra.Term.Var;

import java.util.ArrayList;
import java.util.List;

import static dumb.algebra.Term.num;
import static dumb.algebra.util.Log.warning;
import static java.util.Objects.requireNonNull;

/**
 * Taylor series by repeated symbolic differentiation, simplification and substitution of the
 * expansion point.
 */
public enum Taylor {
    ;

    public static final double ZERO_TOLERANCE = 1e-10;

    public static final int DEFAULT_ORDER = 5;

    public static final int DEFAULT_SUBSTITUTION_DEPTH = 10_000;

    public static List<Term> expand(Term func, Var variable) {
        return expand(func, variable, 0, DEFAULT_ORDER);
    }

    public static List<Term> expand(Term func, Var variable, double point, int order) {
        return expand(func, variable, point, order, Simplifier.DEFAULT_MAX_ITERATIONS, DEFAULT_SUBSTITUTION_DEPTH);
    }

    /**
     * Coefficients {@code [a0 .. a_order]} with {@code a_n = f^(n)(point) / n!}.
     * The derivative is re-simplified after every differentiation step.
     */
    public static List<Term> expand(Term func, Var variable, double point, int order, int maxIterations, int substitutionDepth) {
        requireNonNull(func);
        requireNonNull(variable);
        if (order < 0) throw new IllegalArgumentException("order must be non-negative: " + order);

        var coefficients = new ArrayList<Term>(order + 1);
        var derivative = Simplifier.simplify(func, maxIterations);
        for (var n = 0; n <= order; n++) {
            if (n > 0) derivative = Derivative.nth(derivative, variable, 1, maxIterations);
            coefficients.add(divideByFactorial(evaluateAt(derivative, variable, point, substitutionDepth), n));
        }
        return coefficients;
    }

    public static Term evaluateAt(Term term, Var variable, double point) {
        return evaluateAt(term, variable, point, DEFAULT_SUBSTITUTION_DEPTH);
    }

    /**
     * Replaces every variable named like {@code variable} with {@code point} and folds the
     * all-literal subterms that result. Subterms below {@code maxDepth} are left untouched.
     */
    public static Term evaluateAt(Term term, Var variable, double point, int maxDepth) {
        return substitute(term, variable.name(), point, 0, maxDepth);
    }

    private static Term substitute(Term term, String name, double point, int depth, int maxDepth) {
        if (term instanceof Var v) return v.name().equals(name) ? num(point) : v;
        if (term instanceof Lit) return term;
        if (depth > maxDepth) {
            warning("evaluateAt: substitution depth " + maxDepth + " exceeded at " + term.text());
            return term;
        }
        var c = (Compound) term;
        var evaluated = c.with(c.args.stream().map(a -> substitute(a, name, point, depth + 1, maxDepth)).toList());
        return foldNumeric(evaluated);
    }

    private static Term foldNumeric(Compound c) {
        if (!c.args.stream().allMatch(Lit.class::isInstance)) return c;
        if (c.op == Op.PI) return num(Math.PI);
        if (c.op.trig()) return num(Trig.evaluate(c.op, ((Lit) c.arg(0)).value()));
        if (!c.op.binary()) return c;

        var a = ((Lit) c.arg(0)).value();
        var b = ((Lit) c.arg(1)).value();
        if (c.op == Op.DIV && Math.abs(b) < ZERO_TOLERANCE) return c;
        return num(Simplifier.fold(c.op, a, b));
    }

    /** No guard: a literal is divided, anything else is wrapped in a division node. */
    public static Term divideByFactorial(Term term, int n) {
        if (n == 0) return term;
        var f = factorial(n);
        return term instanceof Lit l ? num(l.value() / f) : term.div(f);
    }

    public static double factorial(int n) {
        var result = 1.0;
        for (var i = 2; i <= n; i++) result *= i;
        return result;
    }

    public static Term toPolynomial(List<Term> coefficients, Var variable, double point) {
        return toPolynomial(coefficients, variable, point, Simplifier.DEFAULT_MAX_ITERATIONS);
    }

    /**
     * {@code a0 + sum a_n (x - point)^n}, skipping literal coefficients within
     * {@link #ZERO_TOLERANCE} of zero for {@code n >= 1}, then simplified.
     */
    public static Term toPolynomial(List<Term> coefficients, Var variable, double point, int maxIterations) {
        if (coefficients.isEmpty()) return num(0);

        var polynomial = coefficients.get(0);
        Term shifted = point == 0 ? variable : variable.sub(point);
        for (var n = 1; n < coefficients.size(); n++) {
            var a = coefficients.get(n);
            if (isZero(a)) continue;
            var power = n == 1 ? shifted : shifted.pow(n);
            polynomial = polynomial.add(a.mul(power));
        }
        return Simplifier.simplify(polynomial, maxIterations);
    }

    private static boolean isZero(Term t) {
        return t instanceof Lit l && Math.abs(l.value()) < ZERO_TOLERANCE;
    }

    /**
     * Ratio test estimate: the largest {@code |a_n / a_(n+1)|} for {@code n >= 1} with
     * {@code a_n} non-zero. Non-literal coefficients count as 1. A zero successor makes the
     * ratio infinite; infinite also when no ratio is available.
     */
    public static double radiusOfConvergence(List<Term> coefficients) {
        var magnitudes = coefficients.stream()
                .mapToDouble(t -> t instanceof Lit l ? Math.abs(l.value()) : 1)
                .toArray();
        var max = 0.0;
        for (var n = 1; n < magnitudes.length - 1; n++) {
            if (magnitudes[n] == 0) continue;
            max = Math.max(max, magnitudes[n] / magnitudes[n + 1]);
        }
        return max == 0 ? Double.POSITIVE_INFINITY : max;
    }

    /** Lagrange remainder bound {@code M |x - a|^(n+1) / (n+1)!}. */
    public static double errorBound(double maxDerivative, double point, double evaluationPoint, int order) {
        return maxDerivative * Math.pow(Math.abs(evaluationPoint - point), order + 1) / factorial(order + 1);
    }

    /** e^x about 0. */
    public static List<Term> expSeries(int order) {
        var c = new ArrayList<Term>(order + 1);
        for (var n = 0; n <= order; n++) c.add(num(1 / factorial(n)));
        return c;
    }

    /** sin(x) about 0. */
    public static List<Term> sinSeries(int order) {
        var c = new ArrayList<Term>(order + 1);
        for (var n = 0; n <= order; n++)
            c.add(num(n % 2 == 0 ? 0 : (n % 4 == 1 ? 1 : -1) / factorial(n)));
        return c;
    }

    /** cos(x) about 0. */
    public static List<Term> cosSeries(int order) {
        var c = new ArrayList<Term>(order + 1);
        for (var n = 0; n <= order; n++)
            c.add(num(n % 2 == 1 ? 0 : (n % 4 == 0 ? 1 : -1) / factorial(n)));
        return c;
    }

    /** ln(1 + x) about 0. */
    public static List<Term> lnSeries(int order) {
        var c = new ArrayList<Term>(order + 1);
        for (var n = 0; n <= order; n++)
            c.add(num(n == 0 ? 0 : (n % 2 == 0 ? -1.0 : 1.0) / n));
        return c;
    }
}
