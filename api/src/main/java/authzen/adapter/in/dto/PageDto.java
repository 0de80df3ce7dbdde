package authzen.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import authzen.core.model.search.PageRequest;

/**
 * Search paging: {@code next_token} from a previous response and an optional {@code limit}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageDto(@JsonProperty("next_token") String nextToken, Integer limit) {

    static PageRequest toModel(PageDto page) {
        return page == null ? PageRequest.first() : new PageRequest(page.nextToken, page.limit);
    }
}
