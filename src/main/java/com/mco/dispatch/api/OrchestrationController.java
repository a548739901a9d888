package com.mco.dispatch.api;

import com.mco.adapter.AdapterExecutionException;
import com.mco.adapter.AdapterNotFoundException;
import com.mco.core.config.ConfigException;
import com.mco.core.engine.Orchestrator;
import com.mco.core.model.DirectiveEnvelope;
import com.mco.core.model.DirectiveType;
import com.mco.core.model.StatusReport;
import com.mco.core.state.OrchestrationNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for the orchestration lifecycle. Thin wrapper over {@link Orchestrator}.
 */
@RestController
@RequestMapping("/api/v1/orchestrations")
public class OrchestrationController {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationController.class);

    private final Orchestrator orchestrator;

    public OrchestrationController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/v1/orchestrations: Start an orchestration from a workflow directory.
     */
    @PostMapping
    public ResponseEntity<?> start(@RequestBody StartOrchestrationRequest request) {
        if (request.configDir() == null || request.configDir().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "config_dir is required"));
        }
        try {
            String id = orchestrator.start(request.configDir(), request.adapter(), request.initialVariables());
            StatusReport status = orchestrator.getStatus(id);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("orchestration_id", id);
            body.put("status", status.status().name());
            body.put("total_steps", status.totalSteps());
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        } catch (ConfigException | AdapterNotFoundException e) {
            log.warn("Rejected orchestration for {}: {}", request.configDir(), e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/orchestrations/{id}: Progress of an orchestration. Unknown ids report
     * status UNKNOWN.
     */
    @GetMapping("/{id}")
    public ResponseEntity<StatusReport> getStatus(@PathVariable String id) {
        return ResponseEntity.ok(orchestrator.getStatus(id));
    }

    /**
     * POST /api/v1/orchestrations/{id}/directive: Next directive, or a COMPLETE/ERROR answer.
     */
    @PostMapping("/{id}/directive")
    public ResponseEntity<DirectiveEnvelope> nextDirective(@PathVariable String id) {
        DirectiveEnvelope envelope = orchestrator.getNextDirective(id);
        if (envelope.type() == DirectiveType.ERROR) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(envelope);
        }
        return ResponseEntity.ok(envelope);
    }

    /**
     * POST /api/v1/orchestrations/{id}/execute: Run the pending directive through the bound adapter.
     */
    @PostMapping("/{id}/execute")
    public ResponseEntity<?> execute(@PathVariable String id) {
        try {
            return ResponseEntity.ok(orchestrator.executeDirective(id));
        } catch (OrchestrationNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (AdapterExecutionException e) {
            log.warn("Execution failed for orchestration {}: {}", id, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of(
                    "error", e.getMessage(),
                    "adapter", String.valueOf(e.getAdapterName())));
        }
    }

    /**
     * POST /api/v1/orchestrations/{id}/result: Report the outcome of the pending directive.
     */
    @PostMapping("/{id}/result")
    public ResponseEntity<?> reportResult(@PathVariable String id, @RequestBody StepResultRequest request) {
        return ResponseEntity.ok(orchestrator.processResult(id, request.toStepResult()));
    }

    /**
     * GET /api/v1/orchestrations/{id}/context: Persistent context of the workflow.
     */
    @GetMapping("/{id}/context")
    public ResponseEntity<Map<String, Object>> persistentContext(@PathVariable String id) {
        try {
            return ResponseEntity.ok(orchestrator.getPersistentContext(id));
        } catch (OrchestrationNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/{id}/variables/{key}")
    public ResponseEntity<Map<String, Object>> getVariable(@PathVariable String id, @PathVariable String key) {
        return orchestrator.getVariable(id, key)
                .map(value -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("key", key);
                    body.put("value", value);
                    return ResponseEntity.ok(body);
                })
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/variables/{key}")
    public ResponseEntity<Void> setVariable(@PathVariable String id, @PathVariable String key,
                                            @RequestBody VariableRequest request) {
        try {
            orchestrator.setVariable(id, key, request.value());
            return ResponseEntity.noContent().build();
        } catch (OrchestrationNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * DELETE /api/v1/orchestrations/{id}: Release the in-process session.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> release(@PathVariable String id) {
        return orchestrator.release(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
