package dumb.algebra;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.algebra.Term.Var;
import dumb.algebra.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;

import static dumb.algebra.util.Log.error;
import static dumb.algebra.util.Log.message;
import static java.util.Objects.requireNonNull;

/**
 * Entry point bundling the engines with one {@link Configuration}.
 */
public class Algebra {

    public static final String CONFIG_RESOURCE = "algebra.json";

    public final Configuration config;

    public Algebra() {
        this(Configuration.load());
    }

    public Algebra(Configuration config) {
        this.config = requireNonNull(config);
    }

    public Term simplify(Term term) {
        return Simplifier.simplify(term, config.maxIterations());
    }

    public Term diff(Term term, Var variable) {
        return Derivative.of(term, variable);
    }

    /** n-th derivative, simplified after every step. */
    public Term diff(Term term, Var variable, int n) {
        return Derivative.nth(term, variable, n, config.maxIterations());
    }

    public Term integrate(Term term, Var variable) {
        return Integral.of(term, variable, config.integrationBudget());
    }

    public Term integrate(Term term, Var variable, Term lower, Term upper) {
        return Integral.of(term, variable, lower, upper);
    }

    public Term simplifyTrig(Term term) {
        return Trig.simplify(term);
    }

    public List<Term> taylor(Term func, Var variable, double point, int order) {
        return Taylor.expand(func, variable, point, order, config.maxIterations(), config.substitutionDepth());
    }

    public Term evaluateAt(Term term, Var variable, double point) {
        return Taylor.evaluateAt(term, variable, point, config.substitutionDepth());
    }

    public Term polynomial(List<Term> coefficients, Var variable, double point) {
        return Taylor.toPolynomial(coefficients, variable, point, config.maxIterations());
    }

    public record Configuration(int maxIterations, int integrationBudget, int substitutionDepth) {
        public static final Configuration DEFAULT = new Configuration(
                Simplifier.DEFAULT_MAX_ITERATIONS, Integral.DEFAULT_BUDGET, Taylor.DEFAULT_SUBSTITUTION_DEPTH);

        public Configuration {
            if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
            if (integrationBudget < 0) throw new IllegalArgumentException("integrationBudget must not be negative: " + integrationBudget);
            if (substitutionDepth < 1) throw new IllegalArgumentException("substitutionDepth must be positive: " + substitutionDepth);
        }

        /** Missing fields take their defaults. */
        @JsonCreator
        public static Configuration of(
                @JsonProperty("maxIterations") @Nullable Integer maxIterations,
                @JsonProperty("integrationBudget") @Nullable Integer integrationBudget,
                @JsonProperty("substitutionDepth") @Nullable Integer substitutionDepth
        ) {
            return new Configuration(
                    maxIterations != null ? maxIterations : DEFAULT.maxIterations,
                    integrationBudget != null ? integrationBudget : DEFAULT.integrationBudget,
                    substitutionDepth != null ? substitutionDepth : DEFAULT.substitutionDepth);
        }

        public static Configuration load() {
            return load(CONFIG_RESOURCE);
        }

        /** Reads a classpath resource; defaults when absent or unreadable. */
        public static Configuration load(String resource) {
            try (var in = Algebra.class.getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    message("Configuration resource " + resource + " not found, using defaults.");
                    return DEFAULT;
                }
                var config = Json.obj(in, Configuration.class);
                message("Configuration loaded from " + resource + ": " + config.toJson());
                return config;
            } catch (IOException | IllegalArgumentException e) {
                error("Error reading configuration " + resource + ", using defaults: " + e.getMessage());
                return DEFAULT;
            }
        }

        public String toJson() {
            return Json.str(this);
        }
    }
}
