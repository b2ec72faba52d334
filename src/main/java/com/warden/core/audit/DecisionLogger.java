package com.warden.core.audit;

import com.warden.core.model.Action;
import com.warden.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Writes one structured record per decision.
 * <p>
 * The record goes to the dedicated {@value #DECISION_LOGGER} logger as a
 * single JSON line and, when an {@link AuditTrail} is attached, into the
 * in-memory trail. Failures are thrown to the caller rather than swallowed;
 * the engine decides how to surface them.
 */
public class DecisionLogger {

    public static final String DECISION_LOGGER = "warden.policy.decisions";

    private static final Logger decisionLog = LoggerFactory.getLogger(DECISION_LOGGER);

    private final DecisionContractCodec codec;
    private final AuditTrail auditTrail;
    private final Level level;

    public DecisionLogger(DecisionContractCodec codec) {
        this(codec, null, Level.INFO);
    }

    /**
     * @param auditTrail optional in-memory trail, may be null
     * @param level      level decision records are logged at
     */
    public DecisionLogger(DecisionContractCodec codec, AuditTrail auditTrail, Level level) {
        this.codec = codec;
        this.auditTrail = auditTrail;
        this.level = level;
    }

    /**
     * @throws DecisionSerializationException if the record cannot be rendered as JSON
     */
    public void log(Decision decision, Action action) {
        AuditEntry entry = AuditEntry.of(decision, action);
        if (auditTrail != null) {
            auditTrail.append(entry);
        }
        String json = codec.toJson(entry);
        decisionLog.atLevel(level).log(json);
    }

    public AuditTrail getAuditTrail() {
        return auditTrail;
    }

    /**
     * Multi-line summary of a decision for terminals and chat surfaces.
     */
    public static String formatForHumans(Decision decision, Action action) {
        StringBuilder sb = new StringBuilder();
        sb.append("[POLICY] ").append(decision.isDenied() ? "DENIED" : "ALLOWED")
                .append(" (severity=").append(decision.severity().wireName()).append(")\n");
        if (action != null) {
            sb.append("  Action: ").append(action.type()).append(" -> ").append(action.target()).append('\n');
        }
        sb.append("  Policy: ").append(decision.policyId()).append('\n');
        sb.append("  Reason: ").append(decision.reason()).append('\n');
        if (decision.suggestion() != null && !decision.suggestion().isEmpty()) {
            sb.append("  Suggestion: ").append(decision.suggestion()).append('\n');
        }
        sb.append("  Time: ").append(decision.timestamp());
        return sb.toString();
    }
}
