package authzen.adapter.in.dto;

import jakarta.validation.Valid;

import authzen.core.model.EvaluationItem;

/**
 * One entry of a batch; missing fields fall back to the batch defaults.
 */
public record EvaluationItemDto(@Valid EntityDto subject, @Valid ActionDto action, @Valid EntityDto resource) {

    public EvaluationItem toModel() {
        return new EvaluationItem(
                EntityDto.toModelOrNull(subject), ActionDto.toModelOrNull(action), EntityDto.toModelOrNull(resource));
    }
}
