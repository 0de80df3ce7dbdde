package authzen.core.port.in;

import io.smallrye.mutiny.Uni;

import authzen.core.model.Entity;
import authzen.core.model.search.ActionSearchRequest;
import authzen.core.model.search.ResourceSearchRequest;
import authzen.core.model.search.SearchResult;
import authzen.core.model.search.SubjectSearchRequest;

/**
 * Port for the AuthZEN search APIs.
 *
 * <p>Each search enumerates candidates from the entity provider and keeps those for
 * which an access evaluation allows.
 */
public interface AccessSearch {

    Uni<SearchResult<Entity>> subjectSearch(SubjectSearchRequest request);

    Uni<SearchResult<Entity>> resourceSearch(ResourceSearchRequest request);

    /**
     * Find the actions the subject may perform on the resource.
     *
     * @param request the search
     * @return Uni with the permitted action names
     */
    Uni<SearchResult<String>> actionSearch(ActionSearchRequest request);
}
