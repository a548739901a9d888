package com.mco.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mco.adapter.AdapterExecutionException;
import com.mco.adapter.AdapterNotFoundException;
import com.mco.core.config.ConfigException;
import com.mco.core.engine.Orchestrator;
import com.mco.core.model.Directive;
import com.mco.core.model.DirectiveEnvelope;
import com.mco.core.model.Evaluation;
import com.mco.core.model.ExecutionOutcome;
import com.mco.core.model.OrchestrationStatus;
import com.mco.core.model.ResultStatus;
import com.mco.core.model.StatusReport;
import com.mco.core.model.StepResult;
import com.mco.core.state.OrchestrationNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OrchestrationController.class)
class OrchestrationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private Orchestrator orchestrator;

    private static Directive directive() {
        return new Directive("plan", "plan", "Outline the report", "Goal: report", 0, 4,
                Map.of("core", Map.of("name", "Quarterly Report")), Map.of());
    }

    // ── POST /api/v1/orchestrations ─────────────────────────────────

    @Test
    @DisplayName("POST /orchestrations returns 201 with the new id")
    void start() throws Exception {
        when(orchestrator.start(eq("/wf/report"), eq("echo"), any())).thenReturn("o-1");
        when(orchestrator.getStatus("o-1")).thenReturn(
                new StatusReport("o-1", OrchestrationStatus.RUNNING, 0, List.of(), 4, 0.0));

        String body = objectMapper.writeValueAsString(
                new StartOrchestrationRequest("/wf/report", "echo", Map.of("region", "EMEA")));

        mockMvc.perform(post("/api/v1/orchestrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orchestration_id").value("o-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.total_steps").value(4));

        verify(orchestrator).start("/wf/report", "echo", Map.of("region", "EMEA"));
    }

    @Test
    @DisplayName("POST /orchestrations without config_dir returns 400")
    void startWithoutConfigDir() throws Exception {
        mockMvc.perform(post("/api/v1/orchestrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"adapter\":\"echo\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("config_dir")));

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("POST /orchestrations with a bad workflow or adapter returns 400")
    void startRejected() throws Exception {
        when(orchestrator.start(eq("/missing"), any(), any()))
                .thenThrow(new ConfigException("Configuration directory does not exist: /missing"));
        when(orchestrator.start(eq("/wf"), eq("nope"), any()))
                .thenThrow(new AdapterNotFoundException("nope", Set.of("echo")));

        mockMvc.perform(post("/api/v1/orchestrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"config_dir\":\"/missing\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("does not exist")));

        mockMvc.perform(post("/api/v1/orchestrations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"config_dir\":\"/wf\",\"adapter\":\"nope\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("Unknown adapter")));
    }

    // ── GET /api/v1/orchestrations/{id} ─────────────────────────────

    @Test
    @DisplayName("GET /orchestrations/{id} returns the status report")
    void getStatus() throws Exception {
        when(orchestrator.getStatus("o-1")).thenReturn(
                new StatusReport("o-1", OrchestrationStatus.RUNNING, 2, List.of("plan", "draft"), 4, 0.5));

        mockMvc.perform(get("/api/v1/orchestrations/o-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.current_step_index").value(2))
                .andExpect(jsonPath("$.completed_steps", hasSize(2)))
                .andExpect(jsonPath("$.progress").value(0.5));
    }

    // ── POST /api/v1/orchestrations/{id}/directive ─────────────────

    @Test
    @DisplayName("POST /directive returns the EXECUTE envelope without empty injected context")
    void nextDirective() throws Exception {
        when(orchestrator.getNextDirective("o-1")).thenReturn(DirectiveEnvelope.execute(directive()));

        mockMvc.perform(post("/api/v1/orchestrations/o-1/directive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("EXECUTE"))
                .andExpect(jsonPath("$.directive.step_id").value("plan"))
                .andExpect(jsonPath("$.directive.persistent_context.core.name").value("Quarterly Report"))
                .andExpect(jsonPath("$.directive.injected_context").doesNotExist())
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    @DisplayName("POST /directive returns COMPLETE with 200 and ERROR with 404")
    void directiveCompleteAndError() throws Exception {
        when(orchestrator.getNextDirective("done")).thenReturn(DirectiveEnvelope.complete("Orchestration complete"));
        when(orchestrator.getNextDirective("nope")).thenReturn(DirectiveEnvelope.error("Unknown orchestration: nope"));

        mockMvc.perform(post("/api/v1/orchestrations/done/directive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("COMPLETE"))
                .andExpect(jsonPath("$.directive").doesNotExist());

        mockMvc.perform(post("/api/v1/orchestrations/nope/directive"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("ERROR"))
                .andExpect(jsonPath("$.message").value("Unknown orchestration: nope"));
    }

    // ── POST /api/v1/orchestrations/{id}/execute ───────────────────

    @Test
    @DisplayName("POST /execute returns the result and its evaluation")
    void execute() throws Exception {
        when(orchestrator.executeDirective("o-1")).thenReturn(new ExecutionOutcome(
                StepResult.success("Task complete: plan"),
                new Evaluation(true, "plan", 0.25, Map.of("goal", "report"))));

        mockMvc.perform(post("/api/v1/orchestrations/o-1/execute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.output").value("Task complete: plan"))
                .andExpect(jsonPath("$.evaluation.success").value(true))
                .andExpect(jsonPath("$.evaluation.progress").value(0.25));
    }

    @Test
    @DisplayName("POST /execute maps missing, conflicting and failed executions")
    void executeErrors() throws Exception {
        when(orchestrator.executeDirective("nope")).thenThrow(new OrchestrationNotFoundException("nope"));
        when(orchestrator.executeDirective("idle")).thenThrow(new IllegalStateException("no current directive"));
        when(orchestrator.executeDirective("down")).thenThrow(
                new AdapterExecutionException("echo", "Adapter 'echo' failed: backend down"));

        mockMvc.perform(post("/api/v1/orchestrations/nope/execute"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/orchestrations/idle/execute"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("no current directive"));
        mockMvc.perform(post("/api/v1/orchestrations/down/execute"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.adapter").value("echo"));
    }

    // ── POST /api/v1/orchestrations/{id}/result ────────────────────

    @Test
    @DisplayName("POST /result passes the reported status through and returns the evaluation")
    void reportResult() throws Exception {
        when(orchestrator.processResult(eq("o-1"), any())).thenReturn(
                new Evaluation(false, "Error: compile failed", 0.25, Map.of("goal", "report")));

        mockMvc.perform(post("/api/v1/orchestrations/o-1/result")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"ERROR\",\"error\":\"compile failed\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.feedback").value("Error: compile failed"))
                .andExpect(jsonPath("$.context.goal").value("report"));

        verify(orchestrator).processResult("o-1", new StepResult(null, ResultStatus.ERROR, "compile failed"));
    }

    // ── Context and variables ───────────────────────────────────────

    @Test
    @DisplayName("GET /context returns 200 or 404")
    void persistentContext() throws Exception {
        when(orchestrator.getPersistentContext("o-1")).thenReturn(Map.of("core", Map.of("name", "Quarterly Report")));
        when(orchestrator.getPersistentContext("nope")).thenThrow(new OrchestrationNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/orchestrations/o-1/context"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.core.name").value("Quarterly Report"));
        mockMvc.perform(get("/api/v1/orchestrations/nope/context"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /variables/{key} returns the value or 404")
    void getVariable() throws Exception {
        when(orchestrator.getVariable("o-1", "region")).thenReturn(Optional.of("EMEA"));
        when(orchestrator.getVariable("o-1", "missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/orchestrations/o-1/variables/region"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.key").value("region"))
                .andExpect(jsonPath("$.value").value("EMEA"));
        mockMvc.perform(get("/api/v1/orchestrations/o-1/variables/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("PUT /variables/{key} returns 204, or 404 for unknown orchestrations")
    void setVariable() throws Exception {
        doThrow(new OrchestrationNotFoundException("nope")).when(orchestrator).setVariable(eq("nope"), any(), any());

        mockMvc.perform(put("/api/v1/orchestrations/o-1/variables/region")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"EMEA\"}"))
                .andExpect(status().isNoContent());
        verify(orchestrator).setVariable("o-1", "region", "EMEA");

        mockMvc.perform(put("/api/v1/orchestrations/nope/variables/region")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\":\"EMEA\"}"))
                .andExpect(status().isNotFound());
    }

    // ── DELETE /api/v1/orchestrations/{id} ──────────────────────────

    @Test
    @DisplayName("DELETE /orchestrations/{id} returns 204 or 404")
    void release() throws Exception {
        when(orchestrator.release("o-1")).thenReturn(true);
        when(orchestrator.release("nope")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/orchestrations/o-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/orchestrations/nope"))
                .andExpect(status().isNotFound());
    }
}
