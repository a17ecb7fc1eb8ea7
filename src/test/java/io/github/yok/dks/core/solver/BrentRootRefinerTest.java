package io.github.yok.dks.core.solver;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.dks.core.error.NonConvergenceException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BrentRootRefiner Tests")
class BrentRootRefinerTest {

    private static final UnivariateFunction COS_MINUS_X = x -> Math.cos(x) - x;

    @Test
    @DisplayName("Should converge to the root inside the bracket")
    void testConverges() {
        BrentRootRefiner refiner = new BrentRootRefiner(1e-14, 1e-15, 100);

        double root = refiner.refine(COS_MINUS_X, new Bracket(0.0, 1.0, 1.0, Math.cos(1.0) - 1.0));

        assertEquals(0.7390851332151607, root, 1e-12);
    }

    @Test
    @DisplayName("Should return an endpoint whose value is exactly zero")
    void testExactEndpoint() {
        BrentRootRefiner refiner = new BrentRootRefiner(1e-12, 1e-12, 100);
        UnivariateFunction fn = x -> x - 2.0;

        assertEquals(2.0, refiner.refine(fn, new Bracket(2.0, 3.0, 0.0, 1.0)), 0.0);
        assertEquals(2.0, refiner.refine(fn, new Bracket(1.0, 2.0, -1.0, 0.0)), 0.0);
    }

    @Test
    @DisplayName("Should report non-convergence when the evaluation budget is exhausted")
    void testBudgetExhausted() {
        BrentRootRefiner refiner = new BrentRootRefiner(1e-14, 1e-15, 2);

        assertThrows(NonConvergenceException.class, () -> refiner.refine(COS_MINUS_X,
                new Bracket(0.0, 1.0, 1.0, Math.cos(1.0) - 1.0)));
    }

    @Test
    @DisplayName("Should report a bracket without a sign change")
    void testNoSignChange() {
        BrentRootRefiner refiner = new BrentRootRefiner(1e-12, 1e-12, 100);

        assertThrows(RootNotBracketedException.class,
                () -> refiner.refine(x -> x + 1.0, new Bracket(0.0, 1.0, 1.0, 2.0)));
    }

    @Test
    @DisplayName("Should validate constructor arguments")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new BrentRootRefiner(-1.0, 1e-12, 10));
        assertThrows(IllegalArgumentException.class, () -> new BrentRootRefiner(1e-12, 0.0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BrentRootRefiner(1e-12, 1e-12, 0));
    }
}
