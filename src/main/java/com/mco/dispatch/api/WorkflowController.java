package com.mco.dispatch.api;

import com.mco.core.config.ConfigException;
import com.mco.core.config.WorkflowConfigLoader;
import com.mco.core.model.WorkflowConfig;
import com.mco.core.model.WorkflowSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for checking workflow directories without starting them.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final WorkflowConfigLoader configLoader;

    public WorkflowController(WorkflowConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    /**
     * POST /api/v1/workflows/validate: Re-read a workflow directory and summarize it.
     * Returns 400 with {@code valid: false} when it cannot be loaded.
     */
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody ValidateWorkflowRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (request.configDir() == null || request.configDir().isBlank()) {
            body.put("valid", false);
            body.put("error", "config_dir is required");
            return ResponseEntity.badRequest().body(body);
        }
        try {
            configLoader.evict(Path.of(request.configDir()));
            WorkflowConfig config = configLoader.load(request.configDir());
            body.put("valid", true);
            body.put("summary", WorkflowSummary.of(config));
            return ResponseEntity.ok(body);
        } catch (ConfigException e) {
            body.put("valid", false);
            body.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(body);
        } catch (InvalidPathException e) {
            body.put("valid", false);
            body.put("error", "Invalid configuration directory: " + e.getMessage());
            return ResponseEntity.badRequest().body(body);
        }
    }
}
