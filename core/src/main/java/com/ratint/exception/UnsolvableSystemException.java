package com.ratint.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown by the linear solver when a system has no solution or is
 * not linear in its unknowns.
 *
 * @see com.ratint.solver.LinearSolver
 */
public class UnsolvableSystemException extends RuntimeException {

    private final List<String> equations;

    /**
     * Creates an unsolvable system exception.
     *
     * @param message the error message
     * @param equations printable forms of the equations, each meaning {@code equation = 0}
     */
    public UnsolvableSystemException(String message, List<String> equations) {
        super(message + " (" + equations.size() + " equations)");
        this.equations = Collections.unmodifiableList(equations);
    }

    public List<String> getEquations() {
        return equations;
    }

    public String getUserMessage() {
        return "The linear system has no solution: " + getMessage();
    }

    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Unsolvable Linear System\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        for (String equation : equations) {
            sb.append("  ").append(equation).append(" = 0\n");
        }
        return sb.toString();
    }
}
