package com.ratint.exception;

/**
 * Exception thrown when an internal invariant of the integration algorithms
 * is violated.
 *
 * <p>For valid input this is unreachable: Hermite's theorem guarantees a unique
 * solution of the reduction system, the subresultant sequence contains a member
 * of every degree that occurs as a multiplicity of the resultant, and the
 * arctangent conversion terminates within the degree bound. Seeing this
 * exception therefore signals a defect, not a user error.
 *
 * <p>The {@code stage} names the algorithm that failed, for example
 * {@code "hermite"}, {@code "log-part"} or {@code "arctan"}.
 */
public class IntegrationInvariantException extends RuntimeException {

    private final String stage;

    public IntegrationInvariantException(String message, String stage) {
        super(message + " (stage: " + stage + ")");
        this.stage = stage;
    }

    public IntegrationInvariantException(String message, Throwable cause, String stage) {
        super(message + " (stage: " + stage + ")", cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return "Integration failed in the " + stage + " stage because of an internal error. " +
               "Please report the integrand that triggered it.";
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Integration Invariant Violated\n");
        sb.append("Stage: ").append(stage).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getSimpleName())
              .append(": ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
