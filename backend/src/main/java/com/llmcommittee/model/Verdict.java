package com.llmcommittee.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one judging request. {@code votes} and {@code voteCounts} are set for voting modes;
 * {@code consensus} is set only in consensus mode, where the winner fields stay empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Verdict(
        String winnerBackendId,
        String winnerLabel,
        String reasoning,
        List<ScoreEntry> scores,
        JudgingMode mode,
        List<JudgeVote> votes,
        Map<String, Integer> voteCounts,
        ConsensusResult consensus
) {
    public Verdict {
        scores = scores == null ? List.of() : List.copyOf(scores);
        votes = votes == null ? null : List.copyOf(votes);
    }
}
