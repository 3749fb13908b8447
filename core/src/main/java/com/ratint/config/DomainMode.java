package com.ratint.config;

/**
 * How logarithmic terms are presented.
 *
 * <ul>
 *   <li>{@code REAL} - convert complex logarithms into real logarithms and arctangents where possible</li>
 *   <li>{@code COMPLEX} - keep every logarithmic term as a sum over the roots of its polynomial</li>
 *   <li>{@code AUTO} (default) - real when every constant in the integrand is real</li>
 * </ul>
 */
public enum DomainMode {
    REAL, COMPLEX, AUTO;

    /**
     * Parse a mode string (case-insensitive).
     *
     * <p>Besides the mode names, {@code "true"} and {@code "false"} are accepted
     * as {@code REAL} and {@code COMPLEX}; {@code null} or a blank string means
     * {@code AUTO}.
     *
     * @param value "real", "complex", "auto", "true" or "false"
     * @return the parsed mode
     * @throws IllegalArgumentException if value is not recognized
     */
    public static DomainMode parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase()) {
            case "real", "true"     -> REAL;
            case "complex", "false" -> COMPLEX;
            case "auto", "unset"    -> AUTO;
            default -> throw new IllegalArgumentException(
                "Unknown domain mode: '%s'. Valid values: real, complex, auto".formatted(value));
        };
    }
}
