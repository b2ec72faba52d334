package com.warden.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.Action;
import com.warden.core.model.Decision;
import com.warden.core.model.DecisionContract;
import com.warden.core.model.ReplanHint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionContractCodecTest {

    private final DecisionContractCodec codec = new DecisionContractCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("contract JSON uses snake_case names in a fixed order")
    void contractFieldNames() throws Exception {
        Decision decision = Decision.deny("act-1", "POL_001_branch_scope", "Policy branch_scope: no direct push",
                ReplanHint.of("Create a feature/* branch and open a PR",
                        Map.of("target_pattern", "refs/heads/feature/*")));

        JsonNode json = mapper.readTree(codec.toJson(decision.toContract()));

        Iterator<String> names = json.fieldNames();
        List<String> expected = List.of("decision_id", "action_id", "policy_id", "result", "reason",
                "suggestion", "alternative", "severity", "timestamp");
        for (String name : expected) {
            assertEquals(name, names.next());
        }
        assertFalse(names.hasNext());
        assertEquals("DENY", json.get("result").asText());
        assertEquals("hard", json.get("severity").asText());
        assertEquals("refs/heads/feature/*", json.get("alternative").get("target_pattern").asText());
    }

    @Test
    @DisplayName("absent hints are written as explicit nulls")
    void explicitNulls() throws Exception {
        Decision decision = Decision.allow("act-1", "POL_000_default_allow",
                "No policy matched; action allowed by default");

        JsonNode json = mapper.readTree(codec.toJson(decision.toContract()));

        assertTrue(json.has("suggestion"));
        assertTrue(json.get("suggestion").isNull());
        assertTrue(json.has("alternative"));
        assertTrue(json.get("alternative").isNull());
    }

    @Test
    @DisplayName("a contract read back keeps every decision field")
    void contractReadBack() {
        DecisionContract original = Decision.deny("act-9", "POL_004_tool_allowlist",
                "Policy tool_allowlist: tool not approved",
                ReplanHint.of("Use an approved tool", Map.of("allowed_tools", List.of("read", "grep"))))
                .toContract();

        DecisionContract restored = codec.readContract(codec.toJson(original));

        assertEquals(original, restored);
    }

    @Test
    @DisplayName("audit entries carry the log type and action fields")
    void auditEntryJson() throws Exception {
        Action action = Action.create("tool.execute", "/bin/rm", Map.of("tool_name", "rm"));
        Decision decision = Decision.deny(action.id(), "POL_004_tool_allowlist", "Policy tool_allowlist: no",
                ReplanHint.of("Use an approved tool"));

        String json = codec.toJson(AuditEntry.of(decision, action));
        JsonNode node = mapper.readTree(json);

        assertEquals("policy_decision", node.get("log_type").asText());
        assertEquals("tool.execute", node.get("action_type").asText());
        assertEquals("rm", node.get("action_metadata").get("tool_name").asText());
        assertEquals(AuditEntry.of(decision, action), codec.readEntry(json));
    }

    @Test
    @DisplayName("malformed input raises DecisionSerializationException")
    void malformedInput() {
        assertThrows(DecisionSerializationException.class, () -> codec.readContract("{not json"));
    }

    @Test
    @DisplayName("values Jackson cannot render raise DecisionSerializationException")
    void unserializableMetadata() {
        Action action = Action.create("file.read", "/tmp/x", Map.of("handle", new Object()));
        Decision decision = Decision.allow(action.id(), "POL_010_read_allow", "ok");

        assertThrows(DecisionSerializationException.class,
                () -> codec.toJson(AuditEntry.of(decision, action)));
    }
}
