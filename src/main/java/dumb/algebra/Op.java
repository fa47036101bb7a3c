package dumb.algebra;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator tags of {@link Term.Compound} nodes.
 */
public enum Op {
    ADD("+", Kind.ARITHMETIC, 2),
    SUB("-", Kind.ARITHMETIC, 2),
    MUL("*", Kind.ARITHMETIC, 2),
    DIV("/", Kind.ARITHMETIC, 2),
    POW("^", Kind.ARITHMETIC, 2),

    SIN("sin", Kind.TRIG, 1),
    COS("cos", Kind.TRIG, 1),
    TAN("tan", Kind.TRIG, 1),
    COT("cot", Kind.TRIG, 1),
    SEC("sec", Kind.TRIG, 1),
    CSC("csc", Kind.TRIG, 1),
    ASIN("asin", Kind.TRIG, 1),
    ACOS("acos", Kind.TRIG, 1),
    ATAN("atan", Kind.TRIG, 1),

    PI("pi", Kind.CONSTANT, 0),

    /** (integrand, variable) or (integrand, variable, lower, upper) */
    INTEGRAL("integral", Kind.INTEGRAL, 2, 4);

    public final String symbol;
    public final Kind kind;
    private final int[] arities;

    Op(String symbol, Kind kind, int... arities) {
        this.symbol = symbol;
        this.kind = kind;
        this.arities = arities;
    }

    public static Optional<Op> of(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }

    public boolean accepts(int size) {
        for (var a : arities)
            if (a == size) return true;
        return false;
    }

    public String arityText() {
        return Arrays.stream(arities).mapToObj(String::valueOf).reduce((a, b) -> a + " or " + b).orElse("");
    }

    public boolean binary() {
        return kind == Kind.ARITHMETIC;
    }

    public boolean trig() {
        return kind == Kind.TRIG;
    }

    public enum Kind {ARITHMETIC, TRIG, CONSTANT, INTEGRAL}
}
