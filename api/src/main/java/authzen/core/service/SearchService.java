package authzen.core.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import authzen.core.config.SearchConfig;
import authzen.core.model.Action;
import authzen.core.model.Decision;
import authzen.core.model.Entity;
import authzen.core.model.EvaluationRequest;
import authzen.core.model.search.ActionSearchRequest;
import authzen.core.model.search.PageRequest;
import authzen.core.model.search.ResourceSearchRequest;
import authzen.core.model.search.SearchResult;
import authzen.core.model.search.SubjectSearchRequest;
import authzen.core.port.in.AccessSearch;
import authzen.core.port.out.EntityProvider;

/**
 * Subject, resource and action search.
 *
 * <p>Candidates come from the entity provider ({@link EntityProvider#scanEntities} or
 * {@link EntityProvider#findApplicableActions}). A page is a window of candidates; each
 * candidate in the window is evaluated like a single access evaluation and kept when
 * allowed. Results keep the provider's enumeration order.
 */
@ApplicationScoped
public class SearchService implements AccessSearch {

    private static final Logger LOG = Logger.getLogger(SearchService.class);

    static final String OP_SEARCH = "search";

    private final EntityProvider entityProvider;
    private final EvaluationService evaluationService;
    private final SearchConfig config;

    @Inject
    public SearchService(EntityProvider entityProvider, EvaluationService evaluationService, SearchConfig config) {
        this.entityProvider = entityProvider;
        this.evaluationService = evaluationService;
        this.config = config;
    }

    @Override
    public Uni<SearchResult<Entity>> subjectSearch(SubjectSearchRequest request) {
        return entityProvider
                .scanEntities(request.subjectType())
                .flatMap(ids -> page(
                        ids,
                        request.page(),
                        id -> new EvaluationRequest(
                                Entity.of(request.subjectType(), id),
                                request.action(),
                                request.resource(),
                                request.context())))
                .map(result -> toEntities(request.subjectType(), result));
    }

    @Override
    public Uni<SearchResult<Entity>> resourceSearch(ResourceSearchRequest request) {
        return entityProvider
                .scanEntities(request.resourceType())
                .flatMap(ids -> page(
                        ids,
                        request.page(),
                        id -> new EvaluationRequest(
                                request.subject(),
                                request.action(),
                                Entity.of(request.resourceType(), id),
                                request.context())))
                .map(result -> toEntities(request.resourceType(), result));
    }

    @Override
    public Uni<SearchResult<String>> actionSearch(ActionSearchRequest request) {
        return entityProvider
                .findApplicableActions(request.subject().type(), request.resource().type())
                .flatMap(actions -> page(
                        actions,
                        request.page(),
                        name -> new EvaluationRequest(
                                request.subject(), Action.named(name), request.resource(), request.context())));
    }

    private Uni<SearchResult<String>> page(
            List<String> candidates, PageRequest page, Function<String, EvaluationRequest> toRequest) {
        final int offset = page.tokenValue().map(PageCursor::decode).orElse(0);
        final int limit = page.limitValue().orElse(config.pageSize());
        final int end = (int) Math.min((long) offset + limit, candidates.size());
        final var window = offset >= candidates.size() ? List.<String>of() : candidates.subList(offset, end);
        final Optional<String> nextToken = end < candidates.size() ? Optional.of(PageCursor.encode(end)) : Optional.empty();

        LOG.debugf("Search page: %d candidates from offset %d of %d", window.size(), offset, candidates.size());
        if (window.isEmpty()) {
            return Uni.createFrom().item(new SearchResult<>(List.of(), nextToken));
        }

        final List<Uni<Decision>> decisions = window.stream()
                .map(candidate -> evaluationService.evaluate(toRequest.apply(candidate), OP_SEARCH))
                .toList();

        return Uni.combine().all().unis(decisions).with(results -> {
            final List<String> allowed = new ArrayList<>();
            for (int i = 0; i < window.size(); i++) {
                if (((Decision) results.get(i)).decision()) {
                    allowed.add(window.get(i));
                }
            }
            return new SearchResult<>(allowed, nextToken);
        });
    }

    private static SearchResult<Entity> toEntities(String type, SearchResult<String> ids) {
        return new SearchResult<>(
                ids.results().stream().map(id -> Entity.of(type, id)).toList(), ids.nextToken());
    }
}
