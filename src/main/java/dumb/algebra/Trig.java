package dumb.algebra;

import dumb.algebra.Term.Compound;
import dumb.algebra.Term.Lit;
import dumb.algebra.Term.Var;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dumb.algebra.Term.isLit;
import static dumb.algebra.Term.num;
import static java.util.Map.entry;

/**
 * Trigonometric and inverse-trigonometric term kinds: factories, derivative table and the
 * exact-value simplification that the generic {@link Simplifier} does not perform.
 */
public enum Trig {
    ;

    public static final double ANGLE_TOLERANCE = 1e-10;

    /** Tabulated angles in radians, keyed by display name. */
    public static final Map<String, Double> COMMON_ANGLES;

    private static final Map<String, Map<Op, Double>> EXACT_VALUES;

    private static final Set<Op> DIRECT = EnumSet.of(Op.SIN, Op.COS, Op.TAN, Op.COT, Op.SEC, Op.CSC);

    static {
        var angles = new LinkedHashMap<String, Double>();
        angles.put("0", 0.0);
        angles.put("π/6", Math.PI / 6);
        angles.put("π/4", Math.PI / 4);
        angles.put("π/3", Math.PI / 3);
        angles.put("π/2", Math.PI / 2);
        angles.put("π", Math.PI);
        angles.put("3π/2", 3 * Math.PI / 2);
        angles.put("2π", 2 * Math.PI);
        COMMON_ANGLES = Collections.unmodifiableMap(angles);

        var r2 = Math.sqrt(2);
        var r3 = Math.sqrt(3);
        var inf = Double.POSITIVE_INFINITY;
        EXACT_VALUES = Map.ofEntries(
                entry("0", values(0, 1, 0, inf, 1, inf)),
                entry("π/6", values(0.5, r3 / 2, 1 / r3, r3, 2 / r3, 2)),
                entry("π/4", values(r2 / 2, r2 / 2, 1, 1, r2, r2)),
                entry("π/3", values(r3 / 2, 0.5, r3, 1 / r3, 2, 2 / r3)),
                entry("π/2", values(1, 0, inf, 0, inf, 1)),
                entry("π", values(0, -1, 0, inf, -1, inf)),
                entry("3π/2", values(-1, 0, inf, 0, inf, -1)),
                entry("2π", values(0, 1, 0, inf, 1, inf)));
    }

    private static Map<Op, Double> values(double sin, double cos, double tan, double cot, double sec, double csc) {
        var m = new EnumMap<Op, Double>(Op.class);
        m.put(Op.SIN, sin);
        m.put(Op.COS, cos);
        m.put(Op.TAN, tan);
        m.put(Op.COT, cot);
        m.put(Op.SEC, sec);
        m.put(Op.CSC, csc);
        return m;
    }

    public static Compound sin(Term x) {
        return Term.of(Op.SIN, x);
    }

    public static Compound sin(double x) {
        return sin(num(x));
    }

    public static Compound cos(Term x) {
        return Term.of(Op.COS, x);
    }

    public static Compound cos(double x) {
        return cos(num(x));
    }

    public static Compound tan(Term x) {
        return Term.of(Op.TAN, x);
    }

    public static Compound tan(double x) {
        return tan(num(x));
    }

    public static Compound cot(Term x) {
        return Term.of(Op.COT, x);
    }

    public static Compound cot(double x) {
        return cot(num(x));
    }

    public static Compound sec(Term x) {
        return Term.of(Op.SEC, x);
    }

    public static Compound sec(double x) {
        return sec(num(x));
    }

    public static Compound csc(Term x) {
        return Term.of(Op.CSC, x);
    }

    public static Compound csc(double x) {
        return csc(num(x));
    }

    public static Compound asin(Term x) {
        return Term.of(Op.ASIN, x);
    }

    public static Compound asin(double x) {
        return asin(num(x));
    }

    public static Compound acos(Term x) {
        return Term.of(Op.ACOS, x);
    }

    public static Compound acos(double x) {
        return acos(num(x));
    }

    public static Compound atan(Term x) {
        return Term.of(Op.ATAN, x);
    }

    public static Compound atan(double x) {
        return atan(num(x));
    }

    public static Compound pi() {
        return Term.of(Op.PI);
    }

    public static boolean isPi(Term t) {
        return t instanceof Compound c && c.op == Op.PI;
    }

    /** Chain-rule derivative of a unary trigonometric node. */
    static Term derivative(Compound c, Var variable) {
        var u = c.arg(0);
        var du = Derivative.of(u, variable);
        return switch (c.op) {
            case SIN -> cos(u).mul(du);
            case COS -> num(-1).mul(sin(u).mul(du));
            case TAN -> du.div(cos(u).pow(2));
            case COT -> num(-1).mul(du.div(sin(u).pow(2)));
            case SEC -> sec(u).mul(tan(u)).mul(du);
            case CSC -> num(-1).mul(csc(u).mul(cot(u)).mul(du));
            case ASIN -> du.div(num(1).sub(u.pow(2)).pow(0.5));
            case ACOS -> num(-1).mul(du.div(num(1).sub(u.pow(2)).pow(0.5)));
            case ATAN -> du.div(num(1).add(u.pow(2)));
            default -> throw new IllegalArgumentException("Not a trigonometric node: " + c.text());
        };
    }

    /** Numeric value of a trigonometric kind at {@code x} radians. */
    public static double evaluate(Op op, double x) {
        return switch (op) {
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
            case COT -> 1 / Math.tan(x);
            case SEC -> 1 / Math.cos(x);
            case CSC -> 1 / Math.sin(x);
            case ASIN -> Math.asin(x);
            case ACOS -> Math.acos(x);
            case ATAN -> Math.atan(x);
            default -> throw new IllegalArgumentException("Not a trigonometric operator: " + op);
        };
    }

    /**
     * Exact value at a tabulated angle. Empty when the angle is not tabulated or the value
     * is infinite there.
     */
    public static Optional<Double> exactValue(Op op, String angle) {
        var row = EXACT_VALUES.get(angle);
        if (row == null) return Optional.empty();
        var v = row.get(op);
        return v == null || v.isInfinite() ? Optional.empty() : Optional.of(v);
    }

    /**
     * Rewrites a top-level sin/cos/tan/cot/sec/csc node: exact value at a tabulated angle,
     * otherwise the ratio identity (tan, cot, sec, csc) or the reflection and shift
     * identities (sin, cos). Any other term is returned as is.
     */
    public static Term simplify(Term term) {
        if (!(term instanceof Compound c) || !DIRECT.contains(c.op)) return term;
        var x = c.arg(0);

        var exact = commonAngle(x).flatMap(a -> exactValue(c.op, a));
        if (exact.isPresent()) return num(exact.get());

        return switch (c.op) {
            case SIN -> simplifySin(x);
            case COS -> simplifyCos(x);
            case TAN -> sin(x).div(cos(x));
            case COT -> cos(x).div(sin(x));
            case SEC -> num(1).div(cos(x));
            case CSC -> num(1).div(sin(x));
            default -> term;
        };
    }

    /**
     * Name of the tabulated angle {@code x} denotes, if any: a literal within
     * {@link #ANGLE_TOLERANCE} of a table entry, or {@code pi() / d} with d in {2, 3, 4, 6}.
     */
    public static Optional<String> commonAngle(Term x) {
        if (x instanceof Lit l) {
            for (var e : COMMON_ANGLES.entrySet())
                if (Math.abs(l.value() - e.getValue()) < ANGLE_TOLERANCE) return Optional.of(e.getKey());
            return Optional.empty();
        }
        if (x instanceof Compound c && c.op == Op.DIV && isPi(c.arg(0)) && c.arg(1) instanceof Lit d) {
            var denominator = d.value();
            if (denominator == 2 || denominator == 3 || denominator == 4 || denominator == 6)
                return Optional.of("π/" + (int) denominator);
        }
        return Optional.empty();
    }

    private static Term simplifySin(Term x) {
        var negated = negated(x);
        if (negated.isPresent()) return num(-1).mul(sin(negated.get()));
        if (x instanceof Compound c && c.op.binary() && isPi(c.arg(0))) {
            if (c.op == Op.SUB) return sin(c.arg(1));
            if (c.op == Op.ADD) return num(-1).mul(sin(c.arg(1)));
        }
        return sin(x);
    }

    private static Term simplifyCos(Term x) {
        var negated = negated(x);
        if (negated.isPresent()) return cos(negated.get());
        if (x instanceof Compound c && (c.op == Op.SUB || c.op == Op.ADD) && isPi(c.arg(0)))
            return num(-1).mul(cos(c.arg(1)));
        return cos(x);
    }

    /** {@code y} when {@code x} has the shape {@code (0 - y)} or {@code (-1 * y)}. */
    private static Optional<Term> negated(Term x) {
        if (x instanceof Compound c
                && ((c.op == Op.SUB && isLit(c.arg(0), 0)) || (c.op == Op.MUL && isLit(c.arg(0), -1))))
            return Optional.of(c.arg(1));
        return Optional.empty();
    }
}
