package authzen.adapter.in.dto;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import authzen.core.model.BatchEvaluationRequest;
import authzen.core.model.EvaluationSemantics;

/**
 * Body of {@code POST /access/v1/evaluations}.
 */
public record EvaluationsRequestDto(
        @Valid EntityDto subject,
        @Valid ActionDto action,
        @Valid EntityDto resource,
        Map<String, Object> context,
        @NotNull(message = "evaluations is required") List<@NotNull @Valid EvaluationItemDto> evaluations,
        EvaluationOptionsDto options) {

    /**
     * @throws IllegalArgumentException on an unknown evaluation semantics or a missing entity id
     */
    public BatchEvaluationRequest toModel() {
        return new BatchEvaluationRequest(
                EntityDto.toModelOrNull(subject),
                ActionDto.toModelOrNull(action),
                EntityDto.toModelOrNull(resource),
                context,
                evaluations.stream().map(EvaluationItemDto::toModel).toList(),
                EvaluationSemantics.fromWireName(options != null ? options.evaluationSemantics() : null));
    }
}
