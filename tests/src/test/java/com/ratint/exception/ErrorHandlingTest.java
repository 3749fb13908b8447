package com.ratint.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ratint.expression.Constant;
import com.ratint.expression.Expressions;
import com.ratint.integration.RationalIntegrator;
import com.ratint.test.TestBase;
import com.ratint.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for error reporting.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Exceptions carry the rejected input or the failing stage</li>
 *   <li>User messages are actionable</li>
 *   <li>Technical messages include the cause for debugging</li>
 * </ul>
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest extends TestBase {

    @Nested
    @DisplayName("InvalidIntegrandException")
    class InvalidIntegrand {

        @Test
        @DisplayName("Zero denominator message")
        void testZeroDenominator() {
            InvalidIntegrandException e = new InvalidIntegrandException("Integrand has a zero denominator", "1 / 0");

            assertThat(e.getIntegrand()).isEqualTo("1 / 0");
            assertThat(e.getMessage()).contains("(integrand: 1 / 0)");
            assertThat(e.getUserMessage()).contains("denominator of the integrand is zero");
        }

        @Test
        @DisplayName("Non-rational input message")
        void testNotRational() {
            InvalidIntegrandException e = new InvalidIntegrandException(
                "Expression is not a polynomial or rational function of x", "log(x)");

            assertThat(e.getUserMessage()).contains("Only rational functions");
        }

        @Test
        @DisplayName("Technical message includes the cause")
        void testTechnicalMessage() {
            InvalidIntegrandException e = new InvalidIntegrandException(
                "Unsupported constant", new ArithmeticException("overflow"), "2^(1/3)");

            assertThat(e.getUserMessage()).contains("2^(1/3)");
            assertThat(e.getTechnicalMessage())
                .contains("Invalid Integrand")
                .contains("Integrand: 2^(1/3)")
                .contains("Cause: overflow");
        }

        @Test
        @DisplayName("The integrator reports invalid input through the exception")
        void testFromIntegrator() {
            RationalIntegrator integrator = new RationalIntegrator();

            assertThatThrownBy(() -> integrator.integrate(Constant.ONE, Constant.ZERO, X))
                .isInstanceOfSatisfying(InvalidIntegrandException.class,
                    e -> assertThat(e.getUserMessage()).contains("denominator of the integrand is zero"));
            assertThatThrownBy(() -> integrator.integrate(Expressions.log(X), X))
                .isInstanceOfSatisfying(InvalidIntegrandException.class,
                    e -> assertThat(e.getUserMessage()).contains("Only rational functions"));
        }
    }

    @Nested
    @DisplayName("IntegrationInvariantException")
    class Invariant {

        @Test
        @DisplayName("Stage is carried in message and accessors")
        void testStage() {
            IntegrationInvariantException e = new IntegrationInvariantException(
                "No subresultant of degree 2", new IllegalStateException("boom"), "log-part");

            assertThat(e.getStage()).isEqualTo("log-part");
            assertThat(e.getMessage()).endsWith("(stage: log-part)");
            assertThat(e.getUserMessage()).contains("log-part stage");
            assertThat(e.getTechnicalMessage())
                .contains("Stage: log-part")
                .contains("Cause: IllegalStateException: boom");
        }
    }

    @Nested
    @DisplayName("UnsolvableSystemException")
    class Unsolvable {

        @Test
        @DisplayName("Equations are listed")
        void testEquations() {
            UnsolvableSystemException e = new UnsolvableSystemException("Inconsistent system",
                List.of("A0 - 1", "A0 - 2"));

            assertThat(e.getEquations()).containsExactly("A0 - 1", "A0 - 2");
            assertThat(e.getMessage()).contains("2 equations");
            assertThat(e.getUserMessage()).startsWith("The linear system has no solution");
            assertThat(e.getTechnicalMessage()).contains("  A0 - 1 = 0").contains("  A0 - 2 = 0");
        }
    }
}
