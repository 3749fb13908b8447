package com.ratint.solver;

import com.ratint.exception.UnsolvableSystemException;
import com.ratint.expression.Symbol;
import com.ratint.polynomial.MultivariatePolynomial;
import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves systems of equations {@code eᵢ = 0} that are linear in a list of unknowns.
 *
 * <p>Each equation is a {@link MultivariatePolynomial} over the unknowns. The
 * system is reduced to a matrix and solved by {@link GaussianElimination};
 * unknowns left free by a rank-deficient system are set to zero.
 */
public final class LinearSolver {

    private static final Logger logger = LoggerFactory.getLogger(LinearSolver.class);

    private LinearSolver() {}

    /**
     * Solves the system.
     *
     * @param equations the left-hand sides, each over exactly {@code unknowns}
     * @param unknowns the unknowns, in column order
     * @param zero the zero of the coefficient field
     * @param <C> the coefficient field
     * @return the value of every unknown, in the order of {@code unknowns}
     * @throws UnsolvableSystemException if an equation is not linear or the system is inconsistent
     */
    public static <C extends FieldElement<C>> Map<Symbol, C> solve(
            List<MultivariatePolynomial<C>> equations, List<Symbol> unknowns, C zero) {
        Objects.requireNonNull(equations, "equations must not be null");
        Objects.requireNonNull(unknowns, "unknowns must not be null");

        int columns = unknowns.size();
        List<List<C>> matrix = new ArrayList<>(equations.size());
        List<C> rhs = new ArrayList<>(equations.size());
        for (MultivariatePolynomial<C> equation : equations) {
            if (!equation.symbols().equals(unknowns)) {
                throw new IllegalArgumentException(
                    "equation over " + equation.symbols() + " does not match unknowns " + unknowns);
            }
            if (equation.totalDegree() > 1) {
                throw new UnsolvableSystemException(
                    "Equation is not linear in the unknowns: " + equation, describe(equations));
            }
            List<C> row = new ArrayList<>(columns);
            for (int i = 0; i < columns; i++) {
                row.add(equation.linearCoefficient(i));
            }
            matrix.add(row);
            rhs.add(equation.constantTerm().negate());
        }

        logger.debug("Solving {} linear equations in {} unknowns", equations.size(), columns);
        GaussianElimination.Solution<C> solution = GaussianElimination.solve(matrix, rhs, columns, zero)
            .orElseThrow(() -> new UnsolvableSystemException("Inconsistent linear system", describe(equations)));
        if (!solution.isUnique()) {
            logger.debug("System has rank {} < {}; free unknowns set to zero", solution.rank(), columns);
        }

        Map<Symbol, C> values = new LinkedHashMap<>();
        for (int i = 0; i < columns; i++) {
            values.put(unknowns.get(i), solution.values().get(i));
        }
        return values;
    }

    private static <C extends FieldElement<C>> List<String> describe(List<MultivariatePolynomial<C>> equations) {
        List<String> text = new ArrayList<>(equations.size());
        for (MultivariatePolynomial<C> equation : equations) {
            text.add(equation.toString());
        }
        return text;
    }
}
