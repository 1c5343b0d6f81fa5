package com.keystone.core.fallback;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FallbackRouterTest {

    private static FallbackContext context(String... tried) {
        return new FallbackContext("WF-1", "STEP-002", FallbackReason.RETRIES_EXHAUSTED,
                Set.of(tried), List.of(), List.of("missing required field 'actions'"), List.of());
    }

    @Test
    @DisplayName("picks the first alternate in matrix order")
    void firstAlternate() {
        var router = new FallbackRouter(role -> true);

        FallbackDecision decision = router.fallback("qa", context("qa")).orElseThrow();

        assertEquals("code-reviewer", decision.toRole());
        assertEquals("qa", decision.fromRole());
        assertEquals(List.of("missing required field 'actions'"), decision.context().failureReasons());
    }

    @Test
    @DisplayName("skips roles that already tried and roles without a worker")
    void skips() {
        var router = new FallbackRouter(role -> !role.equals("code-reviewer"));

        assertEquals("developer", router.fallback("qa", context("qa")).orElseThrow().toRole());
        assertTrue(router.fallback("qa", context("qa", "developer")).isEmpty());
    }

    @Test
    @DisplayName("a developer and an architect cover for each other once")
    void noPingPong() {
        var router = new FallbackRouter(role -> true);

        assertEquals("architect", router.fallback("developer", context("developer")).orElseThrow().toRole());
        assertTrue(router.fallback("architect", context("developer", "architect")).isEmpty());
    }

    @Test
    @DisplayName("roles outside the matrix have no alternate")
    void unknownRole() {
        assertTrue(FallbackRouter.alternatesFor("astronaut").isEmpty());
        assertTrue(new FallbackRouter(role -> true).fallback("astronaut", context()).isEmpty());
    }
}
