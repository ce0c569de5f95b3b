package com.enterprise.workflow.util;

import com.enterprise.workflow.core.ExecutionResult;
import com.enterprise.workflow.core.TaskResult;
import com.enterprise.workflow.core.WorkflowStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonSupportTest {
    
    @Test
    void testToTree() {
        JsonNode list = JsonSupport.toTree(List.of(1, 2, 3));
        JsonNode map = JsonSupport.toTree(Map.of("name", "report"));
        
        assertTrue(list.isArray());
        assertEquals(3, list.size());
        assertEquals("report", map.get("name").asText());
    }
    
    @Test
    void testInstantsAreWrittenAsIsoStrings() throws Exception {
        String json = JsonSupport.toJson(Map.of("at", Instant.parse("2024-03-10T11:00:00Z")));
        
        assertEquals("{\"at\":\"2024-03-10T11:00:00Z\"}", json);
    }
    
    @Test
    void testExecutionResultSnapshot() throws Exception {
        UUID workflowId = UUID.randomUUID();
        Map<String, TaskResult> taskResults = new LinkedHashMap<>();
        taskResults.put("fetch", TaskResult.success(UUID.randomUUID(), "fetch", JsonSupport.object().put("rows", 2)));
        taskResults.put("load", TaskResult.failure(UUID.randomUUID(), "load", "disk full"));
        Instant startedAt = Instant.parse("2024-03-10T11:00:00Z");
        ExecutionResult result = new ExecutionResult(workflowId, "etl", WorkflowStatus.FAILED, taskResults,
            startedAt, startedAt.plusMillis(1500), 1500, "One or more tasks failed: load");
        
        String json = result.toJson();
        ExecutionResult parsed = JsonSupport.fromJson(json, ExecutionResult.class);
        
        assertFalse(JsonSupport.mapper().readTree(json).has("success"));
        assertEquals(workflowId, parsed.getWorkflowId());
        assertEquals(WorkflowStatus.FAILED, parsed.getStatus());
        assertEquals(List.of("fetch", "load"), List.copyOf(parsed.getTaskResults().keySet()));
        assertEquals(2, parsed.getTaskResult("fetch").orElseThrow().getOutput().get("rows").asInt());
        assertEquals("disk full", parsed.getTaskResult("load").orElseThrow().getError());
        assertEquals(1500, parsed.getDurationMs());
        assertFalse(parsed.isSuccess());
    }
}
