package com.goalguard.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goalguard.core.gate.GateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class JsonLogAuditSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("writes one JSON line with runId, type and record")
    void writesEnvelope() throws Exception {
        Logger audit = mock(Logger.class);
        JsonLogAuditSink sink = new JsonLogAuditSink(objectMapper, audit);
        GateResult result = new GateResult("dev_gate", Map.of("lint", false), Map.of(),
                List.of("lint: 1 lint issue(s): unused variable x"), false);

        sink.record("GGRD-2026-0001", AuditSink.GATE_RESULT, result);

        ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
        verify(audit).info(line.capture());
        assertFalse(line.getValue().contains("\n"));

        JsonNode json = objectMapper.readTree(line.getValue());
        assertEquals("GGRD-2026-0001", json.get("runId").asText());
        assertEquals("gate_result", json.get("type").asText());
        assertEquals("dev_gate", json.get("record").get("gateName").asText());
        assertFalse(json.get("record").get("passed").asBoolean());
    }

    @Test
    @DisplayName("an unserializable record is logged, not thrown")
    void unserializable() {
        Logger audit = mock(Logger.class);
        JsonLogAuditSink sink = new JsonLogAuditSink(objectMapper, audit);

        assertDoesNotThrow(() -> sink.record("GGRD-2026-0001", "broken", new Object()));
        verify(audit, never()).info(anyString());
    }
}
