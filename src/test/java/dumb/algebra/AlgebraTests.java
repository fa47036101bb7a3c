package dumb.algebra;

import dumb.algebra.Algebra.Configuration;
import dumb.algebra.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.algebra.Term.num;
import static dumb.algebra.Trig.pi;
import static dumb.algebra.Trig.sin;
import static org.junit.jupiter.api.Assertions.*;

class AlgebraTests extends AbstractTest {

    @Test
    void bundledConfigurationMatchesDefaults() {
        assertEquals(Configuration.DEFAULT, Configuration.load());
        assertEquals(Configuration.DEFAULT, new Algebra().config);
    }

    @Test
    void missingFieldsTakeDefaults() {
        var config = Configuration.load("algebra-partial.json");
        assertEquals(1, config.maxIterations());
        assertEquals(Integral.DEFAULT_BUDGET, config.integrationBudget());
        assertEquals(Taylor.DEFAULT_SUBSTITUTION_DEPTH, config.substitutionDepth());
    }

    @Test
    void unreadableConfigurationFallsBack() {
        assertEquals(Configuration.DEFAULT, Configuration.load("no-such-resource.json"));
        assertEquals(Configuration.DEFAULT, Configuration.load("algebra-broken.json"));
        assertEquals(Configuration.DEFAULT, Configuration.load("algebra-invalid.json"));
    }

    @Test
    void configurationIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> new Configuration(0, 10, 64));
        assertThrows(IllegalArgumentException.class, () -> new Configuration(10, -1, 64));
        assertThrows(IllegalArgumentException.class, () -> new Configuration(10, 10, 0));
    }

    @Test
    void configurationJson() throws Exception {
        var config = new Configuration(3, 4, 5);
        assertEquals(config, Json.obj(config.toJson(), Configuration.class));
    }

    @Test
    void iterationLimitIsApplied() {
        var t = num(3).add(3);
        assertText("(2 * 3)", new Algebra(Configuration.load("algebra-partial.json")).simplify(t));
        assertText("6", new Algebra(Configuration.DEFAULT).simplify(t));
    }

    @Test
    void integrationBudgetIsApplied() {
        var algebra = new Algebra(new Configuration(10, 0, 64));
        assertText("integral((x * x), x)", algebra.integrate(x.mul(x), x));
        assertText("(0.5 * (x^2))", algebra.integrate(x, x));
    }

    @Test
    void facadeDelegates() {
        var algebra = new Algebra(Configuration.DEFAULT);
        assertText("(2 * x)", algebra.simplify(algebra.diff(x.pow(2), x)));
        assertText("(3 * (2 * x))", algebra.diff(x.pow(3), x, 2));
        assertText("integral(x, x, 0, 1)", algebra.integrate(x, x, num(0), num(1)));
        assertLit(0.5, algebra.simplifyTrig(sin(pi().div(6))));
        var coefficients = algebra.taylor(x.pow(2), x, 0, 2);
        assertCoefficients(List.of(num(0), num(0), num(1)), coefficients, TOLERANCE);
        assertText("(x^2)", algebra.polynomial(coefficients, x, 0));
        assertLit(4, algebra.evaluateAt(x.pow(2), x, 2));
    }
}
