package com.goalguard.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each audit record as one JSON line to the {@code goalguard.audit} logger, so the
 * logging backend decides where the audit trail is stored.
 */
public class JsonLogAuditSink implements AuditSink {

    static final String AUDIT_LOGGER = "goalguard.audit";

    private static final Logger log = LoggerFactory.getLogger(JsonLogAuditSink.class);

    private final Logger audit;
    private final ObjectMapper objectMapper;

    public JsonLogAuditSink(ObjectMapper objectMapper) {
        this(objectMapper, LoggerFactory.getLogger(AUDIT_LOGGER));
    }

    JsonLogAuditSink(ObjectMapper objectMapper, Logger audit) {
        this.objectMapper = objectMapper;
        this.audit = audit;
    }

    @Override
    public void record(String runId, String recordType, Object record) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("runId", runId);
        envelope.put("type", recordType);
        envelope.put("record", record);
        try {
            audit.info(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} audit record for run {}: {}", recordType, runId,
                    e.getOriginalMessage(), e);
        }
    }
}
