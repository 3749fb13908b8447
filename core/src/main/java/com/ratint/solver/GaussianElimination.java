package com.ratint.solver;

import com.ratint.types.FieldElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Gauss-Jordan elimination over an exact field.
 *
 * <p>Pivots are chosen as the first nonzero entry of a column; with exact
 * arithmetic no pivoting strategy is needed for stability.
 */
public final class GaussianElimination {

    private GaussianElimination() {}

    /**
     * Result of an elimination: one value per column and the matrix rank.
     *
     * <p>Columns without a pivot (free unknowns) are set to zero.
     *
     * @param values the solution, one entry per column
     * @param rank the rank of the coefficient matrix
     * @param <C> the field element type
     */
    public record Solution<C>(List<C> values, int rank) {

        public Solution {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        /**
         * Returns whether every unknown was determined by a pivot.
         *
         * @return true if the solution is unique
         */
        public boolean isUnique() {
            return rank == values.size();
        }
    }

    /**
     * Solves {@code matrix * y = rhs}.
     *
     * @param matrix row-major coefficient matrix; every row has {@code columns} entries
     * @param rhs right-hand side, one entry per row
     * @param columns the number of unknowns
     * @param zero the zero of the field (needed when the system is empty)
     * @param <C> the field element type
     * @return the solution, or empty if the system is inconsistent
     */
    public static <C extends FieldElement<C>> Optional<Solution<C>> solve(
            List<List<C>> matrix, List<C> rhs, int columns, C zero) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        if (matrix.size() != rhs.size()) {
            throw new IllegalArgumentException(
                "matrix has " + matrix.size() + " rows but rhs has " + rhs.size() + " entries");
        }

        int rows = matrix.size();
        List<List<C>> a = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            List<C> row = matrix.get(i);
            if (row.size() != columns) {
                throw new IllegalArgumentException(
                    "row " + i + " has " + row.size() + " entries, expected " + columns);
            }
            List<C> augmented = new ArrayList<>(row);
            augmented.add(rhs.get(i));
            a.add(augmented);
        }

        int rank = 0;
        int[] pivotColumns = new int[rows];
        for (int col = 0; col < columns && rank < rows; col++) {
            int pivotRow = -1;
            for (int r = rank; r < rows; r++) {
                if (!a.get(r).get(col).isZero()) {
                    pivotRow = r;
                    break;
                }
            }
            if (pivotRow < 0) {
                continue;
            }
            Collections.swap(a, pivotRow, rank);

            List<C> pivot = a.get(rank);
            C inverse = pivot.get(col).inverse();
            for (int k = col; k <= columns; k++) {
                pivot.set(k, pivot.get(k).multiply(inverse));
            }
            for (int r = 0; r < rows; r++) {
                if (r == rank) continue;
                List<C> row = a.get(r);
                C factor = row.get(col);
                if (factor.isZero()) continue;
                for (int k = col; k <= columns; k++) {
                    row.set(k, row.get(k).subtract(factor.multiply(pivot.get(k))));
                }
            }
            pivotColumns[rank] = col;
            rank++;
        }

        for (int r = rank; r < rows; r++) {
            if (!a.get(r).get(columns).isZero()) {
                return Optional.empty();
            }
        }

        List<C> values = new ArrayList<>(Collections.nCopies(columns, zero));
        for (int r = 0; r < rank; r++) {
            values.set(pivotColumns[r], a.get(r).get(columns));
        }
        return Optional.of(new Solution<>(values, rank));
    }
}
