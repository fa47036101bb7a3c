package dumb.algebra;

import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Immutable expression tree node. Equality throughout the engines is canonical-text
 * equality: two terms are the same when {@link #text()} matches.
 */
sealed public interface Term permits Term.Var, Term.Lit, Term.Compound {

    static Var var(String name) {
        return new Var(name);
    }

    static Lit num(double value) {
        return new Lit(value);
    }

    static Compound of(Op op, Term... args) {
        return new Compound(op, List.of(args));
    }

    static Compound of(Op op, List<Term> args) {
        return new Compound(op, args);
    }

    static boolean same(Term a, Term b) {
        return a == b || a.text().equals(b.text());
    }

    static boolean isLit(Term t, double value) {
        return t instanceof Lit l && l.value() == value;
    }

    /** Canonical text, the equality and termination oracle of the engines. */
    String text();

    Set<String> vars();

    int weight();

    JSONObject toJson();

    default Compound add(Term other) {
        return of(Op.ADD, this, other);
    }

    default Compound add(double other) {
        return add(num(other));
    }

    default Compound sub(Term other) {
        return of(Op.SUB, this, other);
    }

    default Compound sub(double other) {
        return sub(num(other));
    }

    default Compound mul(Term other) {
        return of(Op.MUL, this, other);
    }

    default Compound mul(double other) {
        return mul(num(other));
    }

    default Compound div(Term other) {
        return of(Op.DIV, this, other);
    }

    default Compound div(double other) {
        return div(num(other));
    }

    default Compound pow(Term other) {
        return of(Op.POW, this, other);
    }

    default Compound pow(double other) {
        return pow(num(other));
    }

    default Term diff(Var variable) {
        return Derivative.of(this, variable);
    }

    record Var(String name) implements Term {

        public Var {
            requireNonNull(name);
            if (name.isEmpty())
                throw new IllegalArgumentException("Variable name must not be empty");
        }

        @Override
        public String text() {
            return name;
        }

        @Override
        public Set<String> vars() {
            return Set.of(name);
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return text();
        }

        @Override
        public JSONObject toJson() {
            return new JSONObject()
                    .put("type", "var")
                    .put("name", name)
                    .put("text", text());
        }
    }

    record Lit(double value) implements Term {

        /**
         * Plain decimal for magnitudes in [1e-6, 1e21) with no trailing fraction zeros
         * ("2", "0.00001"), exponent form outside it ("1e-7", "1.5e+21").
         */
        public static String format(double v) {
            if (Double.isNaN(v)) return "NaN";
            if (Double.isInfinite(v)) return v > 0 ? "Infinity" : "-Infinity";
            var a = Math.abs(v);
            if (a == 0 || (a >= 1e-6 && a < 1e21))
                return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();

            var s = Double.toString(v);
            var e = s.indexOf('E');
            var mantissa = s.substring(0, e);
            if (mantissa.endsWith(".0")) mantissa = mantissa.substring(0, mantissa.length() - 2);
            var exponent = s.substring(e + 1);
            return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
        }

        @Override
        public String text() {
            return format(value);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Lit l && text().equals(l.text()));
        }

        @Override
        public int hashCode() {
            return text().hashCode();
        }

        @Override
        public Set<String> vars() {
            return Set.of();
        }

        @Override
        public int weight() {
            return 1;
        }

        @Override
        public String toString() {
            return text();
        }

        @Override
        public JSONObject toJson() {
            var json = new JSONObject()
                    .put("type", "literal")
                    .put("text", text());
            return Double.isFinite(value) ? json.put("value", value) : json;
        }
    }

    final class Compound implements Term {
        public final Op op;
        public final List<Term> args;
        private volatile String textCache;
        private volatile int weightCache = -1;
        private volatile Set<String> varsCache;

        Compound(Op op, List<Term> args) {
            this.op = requireNonNull(op);
            this.args = List.copyOf(args);
            if (!op.accepts(this.args.size()))
                throw new ArityException(op, this.args.size());
        }

        public Term arg(int index) {
            return args.get(index);
        }

        public int size() {
            return args.size();
        }

        /** Same operator over new operands. */
        public Compound with(List<Term> newArgs) {
            return new Compound(op, newArgs);
        }

        @Override
        public String text() {
            if (textCache == null) {
                if (op.binary())
                    textCache = op == Op.POW ?
                            "(" + arg(0).text() + "^" + arg(1).text() + ")" :
                            "(" + arg(0).text() + " " + op.symbol + " " + arg(1).text() + ")";
                else
                    textCache = args.stream().map(Term::text).collect(Collectors.joining(", ", op.symbol + "(", ")"));
            }
            return textCache;
        }

        @Override
        public Set<String> vars() {
            if (varsCache == null)
                varsCache = args.stream().flatMap(t -> t.vars().stream()).collect(Collectors.toUnmodifiableSet());
            return varsCache;
        }

        @Override
        public int weight() {
            if (weightCache == -1) weightCache = 1 + args.stream().mapToInt(Term::weight).sum();
            return weightCache;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Compound that && op == that.op && text().equals(that.text()));
        }

        @Override
        public int hashCode() {
            return text().hashCode();
        }

        @Override
        public String toString() {
            return text();
        }

        @Override
        public JSONObject toJson() {
            var jsonArgs = new JSONArray();
            args.forEach(a -> jsonArgs.put(a.toJson()));
            return new JSONObject()
                    .put("type", "compound")
                    .put("op", op.symbol)
                    .put("args", jsonArgs)
                    .put("text", text());
        }
    }

    /** Operand count does not match the operator's fixed arity. */
    class ArityException extends IllegalArgumentException {
        public final Op op;
        public final int size;

        public ArityException(Op op, int size) {
            super("Operator '" + op.symbol + "' takes " + op.arityText() + " operands, got " + size);
            this.op = op;
            this.size = size;
        }
    }
}
