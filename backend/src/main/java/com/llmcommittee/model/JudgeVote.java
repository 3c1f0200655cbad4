package com.llmcommittee.model;

import java.util.List;

/**
 * Accepted verdict of one judge. Judges that fail or return unusable output produce no vote.
 */
public record JudgeVote(
        String judgeId,
        String judgeLabel,
        String winnerBackendId,
        String reasoning,
        List<ScoreEntry> scores
) {
    public JudgeVote {
        scores = scores == null ? List.of() : List.copyOf(scores);
    }
}
