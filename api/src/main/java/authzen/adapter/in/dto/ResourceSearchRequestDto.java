package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import authzen.core.model.search.ResourceSearchRequest;

/**
 * Body of {@code POST /access/v1/search/resource}; the resource id is ignored.
 */
public record ResourceSearchRequestDto(
        @NotNull(message = "subject is required") @Valid EntityDto subject,
        @NotNull(message = "action is required") @Valid ActionDto action,
        @NotNull(message = "resource is required") @Valid EntityDto resource,
        Map<String, Object> context,
        PageDto page) {

    public ResourceSearchRequest toModel() {
        return new ResourceSearchRequest(
                subject.toModel(), action.toModel(), resource.type(), context, PageDto.toModel(page));
    }
}
