package authzen.core.model.search;

import java.util.List;
import java.util.Optional;

/**
 * One page of search results.
 *
 * @param results   matches in enumeration order
 * @param nextToken cursor for the next page, empty on the last page
 * @param <T>       result type
 */
public record SearchResult<T>(List<T> results, Optional<String> nextToken) {

    public SearchResult {
        results = results == null ? List.of() : List.copyOf(results);
        nextToken = nextToken == null ? Optional.empty() : nextToken;
    }
}
