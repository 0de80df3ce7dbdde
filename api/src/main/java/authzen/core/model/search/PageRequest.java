package authzen.core.model.search;

import java.util.Optional;

/**
 * Paging parameters of a search request.
 *
 * @param token opaque cursor from a previous response, or null for the first page
 * @param limit maximum number of candidates to examine, or null for the configured default
 */
public record PageRequest(String token, Integer limit) {

    private static final PageRequest FIRST = new PageRequest(null, null);

    public PageRequest {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("page limit must be positive");
        }
    }

    public static PageRequest first() {
        return FIRST;
    }

    public Optional<String> tokenValue() {
        return Optional.ofNullable(token).filter(t -> !t.isBlank());
    }

    public Optional<Integer> limitValue() {
        return Optional.ofNullable(limit);
    }
}
