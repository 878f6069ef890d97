package com.solverhub.endpoint;

import com.solverhub.capability.CapabilityDescriptor;
import com.solverhub.exception.ConfigurationException;
import com.solverhub.protocol.HttpSolveProtocol;
import com.solverhub.protocol.SolveOutcome;
import com.solverhub.protocol.SolveRequestEnvelope;
import com.solverhub.protocol.SolveResponseEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP surface of the solver endpoint.
 */
@RestController
@ConditionalOnWebApplication
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final SolverEndpoint endpoint;

    public PlanController(SolverEndpoint endpoint) {
        this.endpoint = endpoint;
    }

    @PostMapping(HttpSolveProtocol.PLAN_PATH)
    public SolveResponseEnvelope plan(@RequestBody SolveRequestEnvelope request) {
        if (request.problemLocator() == null || request.problemLocator().isBlank()) {
            throw new ConfigurationException("problemLocator is required");
        }
        CapabilityDescriptor claimed = request.requiredKindDescriptor();
        log.info("Plan request for {} (client kind {})", request.problemLocator(), claimed.toMap());

        SolveOutcome outcome = endpoint.solve(request.problemLocator());
        return SolveResponseEnvelope.from(outcome);
    }

    @GetMapping("/solvers")
    public List<SolverInfo> solvers() {
        return endpoint.registry().solvers().stream()
                .map(SolverInfo::of)
                .toList();
    }

    @GetMapping("/problems/kind")
    public Map<String, List<String>> problemKind(@RequestParam("locator") String locator) {
        return endpoint.problemLoader().requiredKind(locator).toMap();
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(ConfigurationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", e.getMessage()));
    }
}
