package com.llmcommittee.service;

import com.llmcommittee.config.CommitteeJudgeProperties;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.JudgeVote;
import com.llmcommittee.model.JudgingMode;
import com.llmcommittee.model.ScoreEntry;
import com.llmcommittee.model.Verdict;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines accepted judge votes into one verdict. Votes must be given in judge-list order;
 * ties on vote count go to the earliest vote in that order.
 */
@Component
@RequiredArgsConstructor
public class VerdictAggregator {

    private final CommitteeJudgeProperties committeeJudgeProperties;

    public Verdict aggregate(JudgingMode mode, List<JudgeVote> votes, List<AssembledResponse> evaluated) {
        if (votes == null || votes.isEmpty()) {
            throw new IllegalArgumentException("At least one vote is required");
        }

        Map<String, Integer> voteCounts = tally(votes);
        int topCount = voteCounts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        String winnerId = votes.stream()
                .map(JudgeVote::winnerBackendId)
                .filter(backendId -> voteCounts.get(backendId) == topCount)
                .findFirst()
                .orElseThrow();
        String winnerLabel = labelFor(winnerId, evaluated);

        String reasoning = mode.isMultiJudge() || votes.size() > 1
                ? summarize(winnerId, winnerLabel, votes)
                : votes.get(0).reasoning();

        return new Verdict(
                winnerId,
                winnerLabel,
                reasoning,
                averageScores(votes, evaluated),
                mode,
                votes,
                voteCounts,
                null
        );
    }

    static Map<String, Integer> tally(List<JudgeVote> votes) {
        Map<String, Integer> voteCounts = new LinkedHashMap<>();
        for (JudgeVote vote : votes) {
            voteCounts.merge(vote.winnerBackendId(), 1, Integer::sum);
        }
        return voteCounts;
    }

    private List<ScoreEntry> averageScores(List<JudgeVote> votes, List<AssembledResponse> evaluated) {
        int maxEntries = Math.max(0, committeeJudgeProperties.getMaxListEntries());
        List<ScoreEntry> averaged = new ArrayList<>();
        for (String backendId : evaluatedIds(evaluated)) {
            int total = 0;
            int count = 0;
            Set<String> strengths = new LinkedHashSet<>();
            Set<String> weaknesses = new LinkedHashSet<>();
            for (JudgeVote vote : votes) {
                for (ScoreEntry entry : vote.scores()) {
                    if (!entry.backendId().equals(backendId)) {
                        continue;
                    }
                    total += entry.score();
                    count++;
                    strengths.addAll(entry.strengths());
                    weaknesses.addAll(entry.weaknesses());
                }
            }
            if (count == 0) {
                continue;
            }
            averaged.add(new ScoreEntry(
                    backendId,
                    (int) Math.round((double) total / count),
                    limit(strengths, maxEntries),
                    limit(weaknesses, maxEntries)
            ));
        }
        return averaged;
    }

    private String summarize(String winnerId, String winnerLabel, List<JudgeVote> votes) {
        long winnerVotes = votes.stream().filter(vote -> vote.winnerBackendId().equals(winnerId)).count();
        StringBuilder summary = new StringBuilder()
                .append(winnerLabel)
                .append(" won with ")
                .append(winnerVotes)
                .append(" of ")
                .append(votes.size())
                .append(votes.size() == 1 ? " judge vote." : " judge votes.");

        int quoted = 0;
        for (JudgeVote vote : votes) {
            if (quoted >= committeeJudgeProperties.getMaxQuotedReasons()) {
                break;
            }
            if (!vote.winnerBackendId().equals(winnerId)) {
                continue;
            }
            summary.append("\n\n").append(vote.judgeLabel()).append(": ").append(vote.reasoning());
            quoted++;
        }
        return summary.toString();
    }

    private static List<String> evaluatedIds(List<AssembledResponse> evaluated) {
        Set<String> ids = new LinkedHashSet<>();
        for (AssembledResponse response : evaluated) {
            ids.add(response.backendId());
        }
        return new ArrayList<>(ids);
    }

    private static String labelFor(String backendId, List<AssembledResponse> evaluated) {
        return evaluated.stream()
                .filter(response -> response.backendId().equals(backendId))
                .map(AssembledResponse::label)
                .findFirst()
                .orElse(backendId);
    }

    private static List<String> limit(Collection<String> values, int maxEntries) {
        return values.stream().limit(maxEntries).toList();
    }
}
