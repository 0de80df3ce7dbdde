package authzen.adapter.in.dto;

import java.util.List;

import authzen.core.model.Decision;

/**
 * Response of {@code POST /access/v1/evaluations}.
 */
public record EvaluationsResponseDto(List<DecisionDto> evaluations) {

    public static EvaluationsResponseDto fromModel(List<Decision> decisions) {
        return new EvaluationsResponseDto(decisions.stream().map(DecisionDto::fromModel).toList());
    }
}
