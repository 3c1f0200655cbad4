package com.llmcommittee.dto;

import com.llmcommittee.model.JudgingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class CommitteeRequests {

    private CommitteeRequests() {
    }

    /**
     * Not bean-validated; the committee orchestrator checks it and rejections go out as a stream event.
     */
    public record StreamCommitteeRequest(
            String prompt,
            List<String> backendIds
    ) {
    }

    public record JudgeRequest(
            @NotBlank(message = "prompt is required")
            String prompt,

            @NotNull(message = "responses is required")
            List<@NotNull(message = "response entry is required") @Valid ResponseInput> responses,

            JudgingMode mode,
            List<@NotBlank(message = "judge backend id must not be blank") String> judgeBackendIds,

            @Valid
            CriteriaInput criteria
    ) {
    }

    public record EvaluateCommitteeRequest(
            @NotBlank(message = "prompt is required")
            String prompt,

            @NotNull(message = "backendIds is required")
            List<String> backendIds,

            JudgingMode mode,
            List<@NotBlank(message = "judge backend id must not be blank") String> judgeBackendIds,

            @Valid
            CriteriaInput criteria
    ) {
    }

    public record ResponseInput(
            @NotBlank(message = "backendId is required")
            String backendId,

            String label,
            String content,
            String error
    ) {
    }

    /**
     * Either a preset reference ({@code id} only) or a full custom rubric.
     */
    public record CriteriaInput(
            String id,
            String label,
            String description,
            List<@NotNull(message = "criterion entry is required") @Valid CriterionInput> items
    ) {
    }

    public record CriterionInput(
            @NotBlank(message = "criterion name is required")
            String name,

            @NotNull(message = "criterion weight is required")
            @Min(value = 1, message = "criterion weight must be at least 1")
            @Max(value = 5, message = "criterion weight must be at most 5")
            Integer weight,

            String description
    ) {
    }

    public record GenerateCriteriaRequest(
            @NotBlank(message = "description is required")
            @Size(max = 1000, message = "description must be 1000 characters or fewer")
            String description,

            @NotBlank(message = "backendId is required")
            String backendId
    ) {
    }
}
