package dumb.algebra;

import dumb.algebra.Term.Compound;
import dumb.algebra.Term.Lit;

import static dumb.algebra.Term.isLit;
import static dumb.algebra.Term.num;
import static dumb.algebra.Term.same;
import static dumb.algebra.util.Log.debug;

/**
 * Bounded fixpoint rewriting with a fixed set of local rules per arithmetic operator.
 * Knows nothing about trigonometric identities; see {@link Trig#simplify}.
 */
public enum Simplifier {
    ;

    public static final int DEFAULT_MAX_ITERATIONS = 10;

    public static Term simplify(Term term) {
        return simplify(term, DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Runs bottom-up passes until one leaves the canonical text unchanged, or until
     * {@code maxIterations} passes have run, in which case the last result is returned.
     */
    public static Term simplify(Term term, int maxIterations) {
        var current = term;
        for (var i = 0; i < maxIterations; i++) {
            var next = pass(current);
            if (same(next, current)) return next;
            current = next;
        }
        debug("simplify: no fixpoint after " + maxIterations + " passes: " + current.text());
        return current;
    }

    private static Term pass(Term term) {
        if (!(term instanceof Compound c)) return term;
        return rule(c.with(c.args.stream().map(Simplifier::pass).toList()));
    }

    /** Local rewrite of one node whose operands are already simplified. */
    public static Term rule(Compound c) {
        return switch (c.op) {
            case ADD -> add(c);
            case SUB -> sub(c);
            case MUL -> mul(c);
            case DIV -> div(c);
            case POW -> pow(c);
            default -> c;
        };
    }

    /** IEEE-754 folding of a binary arithmetic operator. */
    public static double fold(Op op, double a, double b) {
        return switch (op) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case POW -> Math.pow(a, b);
            default -> throw new IllegalArgumentException("Not a binary arithmetic operator: " + op);
        };
    }

    private static Term add(Compound c) {
        var a = c.arg(0);
        var b = c.arg(1);
        if (isLit(a, 0)) return b;
        if (isLit(b, 0)) return a;
        if (same(a, b)) return num(2).mul(a);
        return foldLits(c);
    }

    private static Term sub(Compound c) {
        var a = c.arg(0);
        var b = c.arg(1);
        if (isLit(b, 0)) return a;
        if (same(a, b)) return num(0);
        return foldLits(c);
    }

    private static Term mul(Compound c) {
        var a = c.arg(0);
        var b = c.arg(1);
        if (isLit(a, 0) || isLit(b, 0)) return num(0);
        if (isLit(a, 1)) return b;
        if (isLit(b, 1)) return a;
        if (same(a, b)) return a.pow(2);
        if (a instanceof Lit && b instanceof Lit) return foldLits(c);
        // literal moves to the front only when it is the sole literal operand
        if (b instanceof Lit) return b.mul(a);
        return c;
    }

    private static Term div(Compound c) {
        var a = c.arg(0);
        var b = c.arg(1);
        if (isLit(b, 1)) return a;
        if (same(a, b)) return num(1);
        if (isLit(a, 0)) return num(0);
        return foldLits(c);
    }

    private static Term pow(Compound c) {
        var base = c.arg(0);
        var exponent = c.arg(1);
        if (isLit(exponent, 0)) return num(1);
        if (isLit(exponent, 1)) return base;
        if (isLit(base, 0)) return num(0);
        if (isLit(base, 1)) return num(1);
        return foldLits(c);
    }

    private static Term foldLits(Compound c) {
        return c.arg(0) instanceof Lit a && c.arg(1) instanceof Lit b ?
                num(fold(c.op, a.value(), b.value())) : c;
    }
}
