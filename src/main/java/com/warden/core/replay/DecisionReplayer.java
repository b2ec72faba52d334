package com.warden.core.replay;

import com.warden.core.audit.AuditEntry;
import com.warden.core.model.Action;
import com.warden.core.model.ActionMetadata;
import com.warden.core.model.DecisionContract;
import com.warden.core.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Re-adjudicates recorded actions and checks that the engine still reaches
 * the same decision. Everything except the decision id and timestamp must
 * match: result, severity, policy id, reason, suggestion and alternative.
 * <p>
 * Replays go through {@link PolicyEngine#evaluate} and are therefore
 * recorded in the decision log like any other evaluation.
 */
public class DecisionReplayer {

    private static final Logger log = LoggerFactory.getLogger(DecisionReplayer.class);

    private final PolicyEngine engine;

    public DecisionReplayer(PolicyEngine engine) {
        this.engine = engine;
    }

    public ReplayResult replay(AuditEntry recorded) {
        if (recorded.actionType() == null || recorded.actionTarget() == null) {
            return new ReplayResult(ReplayStatus.FAIL, recorded.decisionId(), null,
                    List.of("record has no action type/target to replay"));
        }

        Action action = new Action(
                recorded.actionId() != null ? recorded.actionId() : recorded.decisionId(),
                recorded.actionType(),
                recorded.actionTarget(),
                ActionMetadata.of(recorded.actionMetadata()));
        DecisionContract replayed = engine.evaluate(action).toContract();

        List<String> differences = new ArrayList<>();
        compare("result", recorded.result(), replayed.result(), differences);
        compare("severity", recorded.severity(), replayed.severity(), differences);
        compare("policy_id", recorded.policyId(), replayed.policyId(), differences);
        compare("reason", recorded.reason(), replayed.reason(), differences);
        compare("suggestion", recorded.suggestion(), replayed.suggestion(), differences);
        compare("alternative", recorded.alternative(), replayed.alternative(), differences);

        ReplayStatus status = differences.isEmpty() ? ReplayStatus.PASS : ReplayStatus.FAIL;
        if (status == ReplayStatus.FAIL) {
            log.warn("Replay of decision {} drifted: {}", recorded.decisionId(), differences);
        }
        return new ReplayResult(status, recorded.decisionId(), replayed.decisionId(), differences);
    }

    public List<ReplayResult> replayAll(List<AuditEntry> recorded) {
        List<ReplayResult> results = new ArrayList<>(recorded.size());
        for (AuditEntry entry : recorded) {
            results.add(replay(entry));
        }
        return results;
    }

    private static void compare(String field, Object expected, Object actual, List<String> differences) {
        if (!Objects.equals(expected, actual)) {
            differences.add(field + ": recorded=" + expected + ", replayed=" + actual);
        }
    }
}
