package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import authzen.core.model.EvaluationRequest;

/**
 * Body of {@code POST /access/v1/evaluation}.
 */
public record EvaluationRequestDto(
        @NotNull(message = "subject is required") @Valid EntityDto subject,
        @NotNull(message = "action is required") @Valid ActionDto action,
        @NotNull(message = "resource is required") @Valid EntityDto resource,
        Map<String, Object> context) {

    public EvaluationRequest toModel() {
        return new EvaluationRequest(subject.toModel(), action.toModel(), resource.toModel(), context);
    }
}
