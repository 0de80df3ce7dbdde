package authzen.adapter.in.dto;

import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import authzen.core.model.search.SearchResult;

/**
 * Search response. {@code page} is written first and only when more results exist.
 *
 * @param <T> result element type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"page", "results"})
public record SearchResponseDto<T>(PageDto page, List<T> results) {

    public static <M, T> SearchResponseDto<T> fromModel(SearchResult<M> result, Function<M, T> mapper) {
        return new SearchResponseDto<>(
                result.nextToken().map(token -> new PageDto(token, null)).orElse(null),
                result.results().stream().map(mapper).toList());
    }
}
