package com.solverhub.protocol;

import com.solverhub.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Structured transport: {@code POST <address>/plan} with a
 * {@link SolveRequestEnvelope}, answered by a {@link SolveResponseEnvelope}.
 * Built on an {@link AbortableRequestFactory}, {@link #cancel()} closes the
 * connection in flight.
 */
public class HttpSolveProtocol implements SolveProtocol {

    private static final Logger log = LoggerFactory.getLogger(HttpSolveProtocol.class);

    public static final String PLAN_PATH = "/plan";

    private final RestTemplate restTemplate;
    private final AbortableRequestFactory requestFactory;
    private volatile boolean cancelled;

    public HttpSolveProtocol(AbortableRequestFactory requestFactory) {
        this(new RestTemplate(requestFactory), requestFactory);
    }

    /**
     * Without a request factory of its own, cancel only stops later exchanges.
     */
    public HttpSolveProtocol(RestTemplate restTemplate) {
        this(restTemplate, null);
    }

    private HttpSolveProtocol(RestTemplate restTemplate, AbortableRequestFactory requestFactory) {
        this.restTemplate = restTemplate;
        this.requestFactory = requestFactory;
    }

    @Override
    public String describe(SolveRequest request) {
        return "POST " + request.address().httpUrl() + PLAN_PATH + " problem=" + request.problemLocator();
    }

    @Override
    public SolveOutcome exchange(SolveRequest request) {
        if (cancelled) {
            return SolveOutcome.failure("Cancelled before sending");
        }
        String url = request.address().httpUrl() + PLAN_PATH;
        try {
            ResponseEntity<SolveResponseEnvelope> response = restTemplate.postForEntity(
                    url, SolveRequestEnvelope.from(request), SolveResponseEnvelope.class);
            SolveResponseEnvelope body = response.getBody();
            if (body == null) {
                return SolveOutcome.failure("Endpoint " + request.address() + " returned an empty response");
            }
            return body.toOutcome();
        } catch (ResourceAccessException e) {
            if (cancelled) {
                return SolveOutcome.failure("Cancelled while solving");
            }
            throw new TransportException("Solver endpoint unreachable: " + e.getMessage(),
                    request.address().toString(), request.problemLocator(), e);
        } catch (HttpStatusCodeException e) {
            log.warn("Endpoint {} answered {} for {}", request.address(), e.getStatusCode(), request.problemLocator());
            return SolveOutcome.failure("Endpoint answered " + e.getStatusCode() + ": " + e.getResponseBodyAsString());
        } catch (RestClientException e) {
            return SolveOutcome.failure("Invalid response from endpoint " + request.address() + ": " + e.getMessage());
        } finally {
            if (requestFactory != null) {
                requestFactory.forgetRequests();
            }
        }
    }

    @Override
    public void cancel() {
        cancelled = true;
        if (requestFactory != null) {
            log.info("Aborting HTTP exchanges");
            requestFactory.abortAll();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
