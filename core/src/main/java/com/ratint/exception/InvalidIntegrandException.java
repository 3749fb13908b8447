package com.ratint.exception;

/**
 * Exception thrown when an integrand is not a rational function the
 * integrator can accept.
 *
 * <p>Common causes:
 * <ul>
 *   <li>A denominator that is identically zero</li>
 *   <li>Non-polynomial subexpressions in the integration variable (log, atan, fractional powers)</li>
 *   <li>Constants outside the supported coefficient field, such as roots of order above two</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Expression result = integrator.integrate(p, q, x, IntegrationOptions.defaults());
 *   } catch (InvalidIntegrandException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Rejected input: " + e.getIntegrand());
 *   }
 * </pre>
 *
 * @see com.ratint.integration.RationalIntegrator
 */
public class InvalidIntegrandException extends RuntimeException {

    private final String integrand;

    /**
     * Creates an invalid integrand exception.
     *
     * @param message the error message
     * @param integrand printable form of the rejected input
     */
    public InvalidIntegrandException(String message, String integrand) {
        super(message + " (integrand: " + integrand + ")");
        this.integrand = integrand;
    }

    /**
     * Creates an invalid integrand exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param integrand printable form of the rejected input
     */
    public InvalidIntegrandException(String message, Throwable cause, String integrand) {
        super(message + " (integrand: " + integrand + ")", cause);
        this.integrand = integrand;
    }

    /**
     * Returns the rejected input.
     *
     * @return the integrand, or null if not available
     */
    public String getIntegrand() {
        return integrand;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message != null && message.contains("zero denominator")) {
            return "The denominator of the integrand is zero. Check the input expression.";
        }
        if (message != null && message.contains("not a polynomial")) {
            return "Only rational functions of the integration variable can be integrated. " +
                   "Remove logarithms, arctangents and fractional powers of the variable.";
        }
        return "The integrand is not a supported rational function: " + integrand;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Invalid Integrand\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        sb.append("Integrand: ").append(integrand).append("\n");
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
