package com.warden.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.DecisionContract;

/**
 * JSON form of {@link DecisionContract} and {@link AuditEntry}, using the
 * snake_case field names of the wire contract. Absent suggestion and
 * alternative are written as explicit nulls.
 */
public class DecisionContractCodec {

    private final ObjectMapper objectMapper;

    public DecisionContractCodec() {
        this(new ObjectMapper());
    }

    public DecisionContractCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(DecisionContract contract) {
        return write(contract);
    }

    public String toJson(AuditEntry entry) {
        return write(entry);
    }

    public DecisionContract readContract(String json) {
        return read(json, DecisionContract.class);
    }

    public AuditEntry readEntry(String json) {
        return read(json, AuditEntry.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new DecisionSerializationException(
                    "Failed to serialize " + value.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DecisionSerializationException(
                    "Failed to parse " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
