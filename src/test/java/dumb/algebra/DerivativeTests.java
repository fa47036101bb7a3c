package dumb.algebra;

import dumb.algebra.Derivative.DifferentiationException;
import dumb.algebra.Derivative.UnknownOperationException;
import dumb.algebra.Derivative.UnsupportedDifferentiationException;
import org.junit.jupiter.api.Test;

import static dumb.algebra.Term.num;
import static dumb.algebra.Trig.pi;
import static org.junit.jupiter.api.Assertions.*;

class DerivativeTests extends AbstractTest {

    @Test
    void leaves() {
        assertEquals(num(0), Derivative.of(num(5), x));
        assertEquals(num(1), Derivative.of(x, x));
        assertEquals(num(0), Derivative.of(y, x));
        assertEquals(num(1), Derivative.of(Term.var("x"), x));
    }

    @Test
    void sumAndDifference() {
        assertText("(1 + 0)", Derivative.of(x.add(y), x));
        assertText("(1 - 0)", Derivative.of(x.sub(3), x));
    }

    @Test
    void productRule() {
        assertText("((x * 0) + (y * 1))", Derivative.of(x.mul(y), x));
    }

    @Test
    void quotientRule() {
        assertText("(((y * 1) - (x * 0)) / (y^2))", Derivative.of(x.div(y), x));
    }

    @Test
    void powerRuleDoesNotChainThroughTheBase() {
        assertText("(3 * (x^2))", Derivative.of(x.pow(3), x));
        assertText("(2 * ((x + y)^1))", Derivative.of(x.add(y).pow(2), x));
    }

    @Test
    void exponentialRule() {
        assertText("((2^x) * (" + Math.log(2) + " * 1))", Derivative.of(num(2).pow(x), x));
        assertText("((2^(3 * x)) * (" + Math.log(2) + " * ((3 * 1) + (x * 0))))",
                Derivative.of(num(2).pow(num(3).mul(x)), x));
    }

    @Test
    void generalPowerIsUnsupported() {
        var e = assertThrows(UnsupportedDifferentiationException.class, () -> Derivative.of(x.pow(y), x));
        assertText("(x^y)", e.term);
        assertTrue(e.getMessage().endsWith("(x^y)"), e.getMessage());
    }

    @Test
    void integralMarkerIsUnknown() {
        var e = assertThrows(UnknownOperationException.class, () -> Derivative.of(Integral.unresolved(x, x), x));
        assertTrue(e.getMessage().contains("integral"), e.getMessage());
        assertThrows(DifferentiationException.class, () -> Derivative.of(x.mul(Integral.unresolved(x, x)), x));
    }

    @Test
    void piIsConstant() {
        assertText("0", Derivative.of(pi(), x));
    }

    @Test
    void simplifiedPolynomialDerivative() {
        var d = Derivative.of(x.pow(2).add(y.mul(3)), x);
        assertText("((2 * (x^1)) + ((y * 0) + (3 * 0)))", d);
        assertText("(2 * x)", Simplifier.simplify(d));
    }

    @Test
    void nthDerivativeSimplifiesEveryStep() {
        assertText("(3 * (2 * x))", Derivative.nth(x.pow(3), x, 2, Simplifier.DEFAULT_MAX_ITERATIONS));
        assertText("(x^3)", Derivative.nth(x.pow(3), x, 0, Simplifier.DEFAULT_MAX_ITERATIONS));
    }

    @Test
    void nthDerivativeOfQuotientStaysSmall() {
        var d = Derivative.nth(x.div(x.add(1)), x, 4, Simplifier.DEFAULT_MAX_ITERATIONS);
        assertTrue(d.weight() < 10_000, () -> "weight " + d.weight());
    }

    @Test
    void diffMethodDelegates() {
        var t = x.mul(x).add(y);
        assertEquals(Derivative.of(t, x), t.diff(x));
    }

    @Test
    void resultIsFresh() {
        var t = x.mul(y);
        Derivative.of(t, x);
        assertText("(x * y)", t);
    }
}
