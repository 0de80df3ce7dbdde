package authzen.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import io.smallrye.mutiny.Uni;

import authzen.adapter.in.dto.ActionDto;
import authzen.adapter.in.dto.ActionSearchRequestDto;
import authzen.adapter.in.dto.EntityDto;
import authzen.adapter.in.dto.ResourceSearchRequestDto;
import authzen.adapter.in.dto.SearchResponseDto;
import authzen.adapter.in.dto.SubjectSearchRequestDto;
import authzen.core.port.in.AccessSearch;

/**
 * AuthZEN search API.
 *
 * <p>Each endpoint returns the allowed candidates of one page; {@code page.next_token}
 * is present when more candidates remain.
 */
@Path("/access/v1/search")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SearchResource {

    private final AccessSearch accessSearch;

    @Inject
    public SearchResource(AccessSearch accessSearch) {
        this.accessSearch = accessSearch;
    }

    @POST
    @Path("/subject")
    public Uni<SearchResponseDto<EntityDto>> subjectSearch(
            @NotNull(message = "request body is required") @Valid SubjectSearchRequestDto request) {
        return accessSearch
                .subjectSearch(request.toModel())
                .map(result -> SearchResponseDto.fromModel(result, EntityDto::fromModel));
    }

    @POST
    @Path("/resource")
    public Uni<SearchResponseDto<EntityDto>> resourceSearch(
            @NotNull(message = "request body is required") @Valid ResourceSearchRequestDto request) {
        return accessSearch
                .resourceSearch(request.toModel())
                .map(result -> SearchResponseDto.fromModel(result, EntityDto::fromModel));
    }

    @POST
    @Path("/action")
    public Uni<SearchResponseDto<ActionDto>> actionSearch(
            @NotNull(message = "request body is required") @Valid ActionSearchRequestDto request) {
        return accessSearch
                .actionSearch(request.toModel())
                .map(result -> SearchResponseDto.fromModel(result, ActionDto::named));
    }
}
