package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import authzen.core.model.search.SubjectSearchRequest;

/**
 * Body of {@code POST /access/v1/search/subject}; the subject id is ignored.
 */
public record SubjectSearchRequestDto(
        @NotNull(message = "subject is required") @Valid EntityDto subject,
        @NotNull(message = "action is required") @Valid ActionDto action,
        @NotNull(message = "resource is required") @Valid EntityDto resource,
        Map<String, Object> context,
        PageDto page) {

    public SubjectSearchRequest toModel() {
        return new SubjectSearchRequest(
                subject.type(), action.toModel(), resource.toModel(), context, PageDto.toModel(page));
    }
}
