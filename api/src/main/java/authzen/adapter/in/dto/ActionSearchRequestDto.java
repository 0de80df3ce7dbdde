package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import authzen.core.model.search.ActionSearchRequest;

/**
 * Body of {@code POST /access/v1/search/action}.
 */
public record ActionSearchRequestDto(
        @NotNull(message = "subject is required") @Valid EntityDto subject,
        @NotNull(message = "resource is required") @Valid EntityDto resource,
        Map<String, Object> context,
        PageDto page) {

    public ActionSearchRequest toModel() {
        return new ActionSearchRequest(subject.toModel(), resource.toModel(), context, PageDto.toModel(page));
    }
}
