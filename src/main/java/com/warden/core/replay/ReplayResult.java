package com.warden.core.replay;

import java.util.List;

/**
 * Outcome of replaying one recorded decision.
 *
 * @param status             PASS when the replayed decision matches the recorded one
 * @param recordedDecisionId decision id from the audit record
 * @param replayedDecisionId decision id produced by the replay, null if the record could not be replayed
 * @param differences        one line per mismatching field, empty on PASS
 */
public record ReplayResult(
    ReplayStatus status,
    String recordedDecisionId,
    String replayedDecisionId,
    List<String> differences
) {

    public ReplayResult {
        differences = List.copyOf(differences);
    }

    public boolean passed() {
        return status == ReplayStatus.PASS;
    }
}
