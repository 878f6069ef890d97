package com.solverhub.solver;

import com.solverhub.capability.CapabilityCategory;
import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.exception.UnsupportedProblemException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultSolverRegistry.
 */
class DefaultSolverRegistryTest {

    private static final CapabilityDescriptor FLAT = CapabilityDescriptor.builder()
            .set(CapabilityCategory.TYPING, "FLAT_TYPING")
            .build();
    private static final CapabilityDescriptor TEMPORAL = CapabilityDescriptor.builder()
            .set(CapabilityCategory.TYPING, "FLAT_TYPING")
            .set(CapabilityCategory.TIME, "CONTINUOUS_TIME")
            .build();

    private DefaultSolverRegistry registry;
    private StubSolver classical;
    private StubSolver temporal;

    @BeforeEach
    void setUp() {
        registry = new DefaultSolverRegistry();
        classical = StubSolver.planner("classical", FLAT);
        temporal = StubSolver.planner("temporal", TEMPORAL);
        registry.register(classical);
        registry.register(temporal);
        classical.open();
        temporal.open();
    }

    @Test
    @DisplayName("Should reject a duplicate solver name")
    void shouldRejectDuplicateName() {
        assertThrows(ConfigurationException.class,
                () -> registry.register(StubSolver.planner("classical", TEMPORAL)));
        assertSame(classical, registry.get("classical").orElseThrow());
    }

    @Test
    @DisplayName("Should keep registration order")
    void shouldKeepRegistrationOrder() {
        assertEquals(List.of(classical, temporal), registry.solvers());
        assertTrue(registry.get("missing").isEmpty());
    }

    @Test
    @DisplayName("Should index solvers by role")
    void shouldIndexByRole() {
        StubSolver validator = new StubSolver("val", FLAT, Set.of(SolverRole.PLAN_VALIDATOR));
        registry.register(validator);

        assertEquals(List.of(validator), registry.withRole(SolverRole.PLAN_VALIDATOR));
        assertEquals(2, registry.withRole(SolverRole.ONESHOT_PLANNER).size());
        assertTrue(registry.withRole(SolverRole.GROUNDER).isEmpty());
    }

    @Test
    @DisplayName("Should select the first planner whose capabilities cover the problem")
    void shouldSelectByCapability() {
        CapabilityDescriptor temporalProblem = CapabilityDescriptor.builder()
                .set(CapabilityCategory.TIME, "CONTINUOUS_TIME")
                .build();

        assertSame(classical, registry.select(FLAT, SolverRole.ONESHOT_PLANNER).orElseThrow());
        assertSame(temporal, registry.select(temporalProblem, SolverRole.ONESHOT_PLANNER).orElseThrow());
    }

    @Test
    @DisplayName("Should skip solvers that are not ready")
    void shouldSkipDestroyedSolvers() {
        classical.destroy();

        assertSame(temporal, registry.select(FLAT, SolverRole.ONESHOT_PLANNER).orElseThrow());
    }

    @Test
    @DisplayName("Should fail require when nothing supports the problem")
    void shouldFailRequire() {
        CapabilityDescriptor numeric = CapabilityDescriptor.builder()
                .set(CapabilityCategory.FLUENTS_TYPE, "NUMERIC_FLUENTS")
                .build();

        assertTrue(registry.select(numeric, SolverRole.ONESHOT_PLANNER).isEmpty());
        UnsupportedProblemException e = assertThrows(UnsupportedProblemException.class,
                () -> registry.require(numeric, SolverRole.ONESHOT_PLANNER));
        assertEquals(numeric, e.getRequiredKind());
    }

    @Test
    @DisplayName("Should destroy every solver")
    void shouldDestroyAll() {
        registry.destroyAll();

        assertEquals(SolverState.DESTROYED, classical.state());
        assertEquals(SolverState.DESTROYED, temporal.state());
    }
}
