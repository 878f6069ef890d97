package com.solverhub.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solverhub.exception.SolveFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SolveResponseEnvelope and ExitStatus.
 */
class SolveResponseEnvelopeTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private void assertJsonEquals(String expected, String actual) throws Exception {
        assertEquals(objectMapper.readTree(expected), objectMapper.readTree(actual));
    }

    @Test
    @DisplayName("Should print a plan as a RESPONSE line")
    void shouldPrintResponseLine() throws Exception {
        SolveOutcome outcome = SolveOutcome.planFound(new Plan(List.of(new PlanAction("a", List.of("x")))));

        String line = SolveResponseEnvelope.from(outcome).toResponseLine();

        assertTrue(line.startsWith(SolveResponseEnvelope.RESPONSE_PREFIX));
        assertFalse(line.contains("\n"));
        assertJsonEquals("{\"status\":\"PLAN_FOUND\",\"plan\":{\"actions\":[{\"name\":\"a\",\"parameters\":[\"x\"]}]}}",
                line.substring(SolveResponseEnvelope.RESPONSE_PREFIX.length()));
    }

    @Test
    @DisplayName("Should omit absent fields")
    void shouldOmitNulls() throws Exception {
        assertJsonEquals("{\"status\":\"UNSOLVABLE\"}", SolveResponseEnvelope.from(SolveOutcome.unsolvable()).toJson());
        assertJsonEquals("{\"status\":\"FAILURE\",\"message\":\"boom\"}",
                SolveResponseEnvelope.from(SolveOutcome.failure("boom")).toJson());
    }

    @Test
    @DisplayName("Should find the last RESPONSE line in output")
    void shouldFindLastResponseLine() {
        String output = """
                INFO starting
                RESPONSE={"status":"FAILURE","message":"first"}
                RESPONSE={"status":"UNSUPPORTED","message":"second"}
                INFO done
                """;

        SolveResponseEnvelope envelope = SolveResponseEnvelope.findInOutput(output).orElseThrow();

        assertEquals(SolveOutcome.unsupported("second"), envelope.toOutcome());
        assertTrue(SolveResponseEnvelope.findInOutput("(a)\n(b)").isEmpty());
        assertTrue(SolveResponseEnvelope.findInOutput(null).isEmpty());
    }

    @Test
    @DisplayName("Should skip a response line that is not a JSON envelope")
    void shouldSkipNonJsonResponseLine() {
        assertTrue(SolveResponseEnvelope.findInOutput(
                "RESPONSE=Answer { status: 0, plan: Some(Plan { actions: [] }) }").isEmpty());
        assertTrue(SolveResponseEnvelope.findInOutput("RESPONSE=").isEmpty());
    }

    @Test
    @DisplayName("Should tolerate unknown fields and reject malformed JSON")
    void shouldParseLeniently() {
        assertEquals(SolveOutcome.unsolvable(),
                SolveResponseEnvelope.fromJson("{\"status\":\"UNSOLVABLE\",\"engine\":\"aries\"}").toOutcome());
        assertThrows(SolveFailureException.class, () -> SolveResponseEnvelope.fromJson("{\"status\":"));
    }

    @Test
    @DisplayName("Plan status without a plan is a failure")
    void shouldRejectPlanStatusWithoutPlan() {
        assertEquals(OutcomeStatus.FAILURE, new SolveResponseEnvelope(OutcomeStatus.PLAN_FOUND, null, null)
                .toOutcome().status());
        assertEquals(OutcomeStatus.FAILURE, new SolveResponseEnvelope(null, null, null).toOutcome().status());
    }

    // ===== Exit status =====

    @ParameterizedTest
    @CsvSource({
            "PLAN_FOUND, 0",
            "FAILURE, 1",
            "UNSOLVABLE, 2",
            "UNSUPPORTED, 3"
    })
    @DisplayName("Each outcome has its own exit code")
    void shouldMapExitCodes(OutcomeStatus status, int code) {
        SolveOutcome outcome = new SolveResponseEnvelope(status,
                status == OutcomeStatus.PLAN_FOUND ? new Plan(List.of()) : null, "m").toOutcome();

        assertEquals(code, ExitStatus.of(outcome).code());
        assertEquals(ExitStatus.of(outcome), ExitStatus.fromCode(code));
    }
}
