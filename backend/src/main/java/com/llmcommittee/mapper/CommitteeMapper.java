package com.llmcommittee.mapper;

import com.llmcommittee.dto.CommitteeRequests;
import com.llmcommittee.dto.CommitteeResponses;
import com.llmcommittee.model.AssembledResponse;
import com.llmcommittee.model.CommitteeEvaluation;
import com.llmcommittee.model.Criteria;
import com.llmcommittee.model.CriteriaPresets;
import com.llmcommittee.model.JudgingRequest;
import com.llmcommittee.model.TokenDeltaEvent;
import com.llmcommittee.service.BackendLabelResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

@Component
@RequiredArgsConstructor
public class CommitteeMapper {

    private final BackendLabelResolver backendLabelResolver;

    public CommitteeResponses.StreamChunk toStreamChunk(TokenDeltaEvent event) {
        if (event.isFailure()) {
            return new CommitteeResponses.StreamChunk(event.backendId(), null, true, event.errorMessage());
        }
        return new CommitteeResponses.StreamChunk(
                event.backendId(),
                event.isFinal() ? "" : event.textFragment(),
                event.isFinal(),
                null
        );
    }

    public CommitteeResponses.StreamChunk toStreamError(String message) {
        return new CommitteeResponses.StreamChunk(null, null, true, message);
    }

    public JudgingRequest toJudgingRequest(CommitteeRequests.JudgeRequest request) {
        return new JudgingRequest(
                request.prompt(),
                toAssembledResponses(request.responses()),
                request.mode(),
                request.judgeBackendIds(),
                toCriteria(request.criteria())
        );
    }

    public List<AssembledResponse> toAssembledResponses(List<CommitteeRequests.ResponseInput> inputs) {
        if (inputs == null) {
            return List.of();
        }
        return inputs.stream()
                .map(input -> new AssembledResponse(
                        input.backendId().trim(),
                        StringUtils.hasText(input.label())
                                ? input.label().trim()
                                : backendLabelResolver.labelFor(input.backendId().trim()),
                        input.content(),
                        StringUtils.hasText(input.error()) ? input.error() : null,
                        null
                ))
                .toList();
    }

    /**
     * Resolves a rubric: explicit items win, then a preset id; anything else means the default rubric.
     */
    public Criteria toCriteria(CommitteeRequests.CriteriaInput input) {
        if (input == null) {
            return null;
        }
        if (input.items() != null && !input.items().isEmpty()) {
            return new Criteria(
                    StringUtils.hasText(input.id()) ? input.id().trim() : CriteriaPresets.CUSTOM_CRITERIA_ID,
                    input.label(),
                    input.description(),
                    input.items().stream()
                            .map(item -> new Criteria.Item(
                                    item.name().trim(),
                                    item.weight(),
                                    item.description() == null ? "" : item.description().trim()
                            ))
                            .toList()
            );
        }
        return CriteriaPresets.findById(input.id()).orElse(null);
    }

    public CommitteeResponses.EvaluationResponse toEvaluationResponse(CommitteeEvaluation evaluation) {
        return new CommitteeResponses.EvaluationResponse(evaluation.responses(), evaluation.verdict());
    }
}
