package com.swarmgraph.dispatch.api;

import com.swarmgraph.core.engine.NodeExecutionException;
import com.swarmgraph.core.engine.RunCancelledException;
import com.swarmgraph.core.engine.RunOptions;
import com.swarmgraph.core.engine.SwarmEngine;
import com.swarmgraph.core.engine.SwarmRegistry;
import com.swarmgraph.core.engine.SwarmResult;
import com.swarmgraph.core.engine.UnknownSwarmException;
import com.swarmgraph.core.llm.GenerationFailure;
import com.swarmgraph.core.llm.ProviderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface over {@link SwarmEngine}. Runs execute synchronously on the request thread.
 */
@RestController
@RequestMapping("/api/v1/swarms")
public class SwarmController {

    private static final Logger log = LoggerFactory.getLogger(SwarmController.class);

    private final SwarmEngine engine;
    private final SwarmRegistry registry;

    public SwarmController(SwarmEngine engine, SwarmRegistry registry) {
        this.engine = engine;
        this.registry = registry;
    }

    /**
     * GET /api/v1/swarms: list registered swarms with their execution rounds.
     */
    @GetMapping
    public List<SwarmSummary> listSwarms() {
        return registry.list().stream().map(SwarmSummary::of).toList();
    }

    /**
     * POST /api/v1/swarms/{name}/runs: run a swarm to completion and return its result.
     */
    @PostMapping("/{name}/runs")
    public ResponseEntity<?> run(@PathVariable String name, @RequestBody RunRequest request) {
        if (request.payload() == null || request.payload().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "payload is required"));
        }
        int maxIterations = request.maxIterations() != null
                ? request.maxIterations() : RunOptions.DEFAULT_MAX_ITERATIONS;
        if (maxIterations < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "max_iterations must be at least 1"));
        }

        log.info("Run requested for swarm {}", name);
        SwarmResult result = engine.run(name, request.payload(), RunOptions.withMaxIterations(maxIterations));
        return ResponseEntity.ok(result);
    }

    @ExceptionHandler(UnknownSwarmException.class)
    public ResponseEntity<Map<String, String>> unknownSwarm(UnknownSwarmException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<Map<String, String>> providerUnavailable(ProviderUnavailableException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler({NodeExecutionException.class, GenerationFailure.class})
    public ResponseEntity<Map<String, String>> generationFailed(RuntimeException e) {
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(RunCancelledException.class)
    public ResponseEntity<Map<String, String>> cancelled(RunCancelledException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, Exception e) {
        log.warn("Request failed with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
