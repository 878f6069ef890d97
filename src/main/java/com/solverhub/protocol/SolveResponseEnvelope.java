package com.solverhub.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solverhub.exception.SolveFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Structured response of a solver endpoint. Returned as the body of
 * {@code POST /plan} and printed on a {@value #RESPONSE_PREFIX} line by the
 * one-shot endpoint.
 *
 * @param status  Outcome tag
 * @param plan    Plan, present only for {@link OutcomeStatus#PLAN_FOUND}
 * @param message Reason or error text for the other tags
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResponseEnvelope(OutcomeStatus status, Plan plan, String message) {

    public static final String RESPONSE_PREFIX = "RESPONSE=";

    private static final Logger log = LoggerFactory.getLogger(SolveResponseEnvelope.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static SolveResponseEnvelope from(SolveOutcome outcome) {
        if (outcome instanceof SolveOutcome.PlanFound found) {
            return new SolveResponseEnvelope(OutcomeStatus.PLAN_FOUND, found.plan(), null);
        }
        if (outcome instanceof SolveOutcome.Unsupported unsupported) {
            return new SolveResponseEnvelope(OutcomeStatus.UNSUPPORTED, null, unsupported.reason());
        }
        if (outcome instanceof SolveOutcome.Failure failure) {
            return new SolveResponseEnvelope(OutcomeStatus.FAILURE, null, failure.error());
        }
        return new SolveResponseEnvelope(outcome.status(), null, null);
    }

    public SolveOutcome toOutcome() {
        if (status == null) {
            return SolveOutcome.failure("Response envelope carries no status");
        }
        return switch (status) {
            case PLAN_FOUND -> plan != null
                    ? SolveOutcome.planFound(plan)
                    : SolveOutcome.failure("Response envelope reports a plan but carries none");
            case UNSOLVABLE -> SolveOutcome.unsolvable();
            case UNSUPPORTED -> SolveOutcome.unsupported(message != null ? message : "rejected by solver");
            case FAILURE -> SolveOutcome.failure(message != null ? message : "solver reported failure");
        };
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new SolveFailureException("Cannot serialize response envelope: " + e.getMessage(), e);
        }
    }

    /**
     * The line printed by the one-shot endpoint.
     */
    public String toResponseLine() {
        return RESPONSE_PREFIX + toJson();
    }

    public static SolveResponseEnvelope fromJson(String json) {
        try {
            return objectMapper.readValue(json, SolveResponseEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new SolveFailureException("Malformed response envelope: " + e.getMessage(), e);
        }
    }

    /**
     * Find the last {@value #RESPONSE_PREFIX} line in process output and read
     * it as an envelope. A payload that is not a JSON envelope (up-server
     * prints a debug dump of its answer there) counts as no envelope.
     */
    public static Optional<SolveResponseEnvelope> findInOutput(String output) {
        if (output == null || output.isEmpty()) {
            return Optional.empty();
        }
        String[] lines = output.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            String line = lines[i].trim();
            if (line.startsWith(RESPONSE_PREFIX)) {
                return tryParse(line.substring(RESPONSE_PREFIX.length()));
            }
        }
        return Optional.empty();
    }

    private static Optional<SolveResponseEnvelope> tryParse(String payload) {
        try {
            return Optional.of(objectMapper.readValue(payload, SolveResponseEnvelope.class));
        } catch (JsonProcessingException e) {
            log.debug("Ignoring non-JSON response line: {}", payload);
            return Optional.empty();
        }
    }
}
