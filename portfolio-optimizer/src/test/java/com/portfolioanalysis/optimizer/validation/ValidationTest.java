package com.portfolioanalysis.optimizer.validation;

import com.portfolioanalysis.optimizer.controller.dto.EvaluationRequest;
import com.portfolioanalysis.optimizer.controller.dto.SimulationRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for input validation and constraint violations.
 */
class ValidationTest {

    private static Validator validator;

    @BeforeAll
    static void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    private SimulationRequest createValidRequest() {
        return SimulationRequest.builder()
                .symbols(List.of("AAPL", "MSFT", "GOOG"))
                .numPortfolios(10000)
                .riskFreeRate(0.03)
                .edgeThreshold(0.001)
                .seed(42L)
                .build();
    }

    @Test
    void testValidRequest_NoViolations() {
        // Arrange
        SimulationRequest request = createValidRequest();

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertTrue(violations.isEmpty(), "Valid request should have no violations");
    }

    @Test
    void testOptionalFieldsOmitted_NoViolations() {
        SimulationRequest request = SimulationRequest.builder().symbols(List.of("AAPL")).build();

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testMissingSymbols_NoViolation() {
        // The service falls back to the allocation keys or the default portfolio
        SimulationRequest request = createValidRequest();
        request.setSymbols(null);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    void testZeroPortfolios_Violation() {
        // Arrange
        SimulationRequest request = createValidRequest();
        request.setNumPortfolios(0);

        // Act
        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        // Assert
        assertEquals(1, violations.size());
        assertEquals("numPortfolios", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testPortfolioUpperBound() {
        SimulationRequest request = createValidRequest();

        request.setNumPortfolios(100000);
        assertTrue(validator.validate(request).isEmpty());

        request.setNumPortfolios(100001);
        assertEquals(1, validator.validate(request).size());
    }

    @Test
    void testNegativeEdgeThreshold_Violation() {
        SimulationRequest request = createValidRequest();
        request.setEdgeThreshold(-0.01);

        Set<ConstraintViolation<SimulationRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertEquals("edgeThreshold", violations.iterator().next().getPropertyPath().toString());
    }

    @Test
    void testRiskFreeRateOutOfRange_Violation() {
        SimulationRequest request = createValidRequest();
        request.setRiskFreeRate(3.0);

        assertEquals(1, validator.validate(request).size());
    }

    @Test
    void testEvaluationRequest_EmptyAllocations() {
        EvaluationRequest request = EvaluationRequest.builder().allocations(Map.of()).build();

        Set<ConstraintViolation<EvaluationRequest>> violations = validator.validate(request);

        assertEquals(1, violations.size());
        assertEquals("allocations", violations.iterator().next().getPropertyPath().toString());
    }
}
