package authzen.core.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

/**
 * Resolves entities together with their ancestors in rounds.
 *
 * <p>Each round fetches the current frontier in one call, adds what was found to the
 * result, and builds the next frontier from the parents not seen yet. The loop ends when
 * the frontier is empty or the hop limit is reached. A uid is fetched at most once, so
 * cyclic parent graphs terminate.
 *
 * <p>Result order: requested entities in request order, then each round's parents in
 * discovery order.
 */
public final class ParentClosure {

    /** Hop limit meaning "follow parents until none are left". */
    public static final int UNLIMITED = -1;

    private final Function<List<EntityUid>, Uni<Map<String, ResolvedEntity>>> fetchRound;
    private final int maxParentHops;

    /**
     * @param fetchRound    looks up a list of uids, returning found entities keyed by
     *                      {@link EntityUid#key()}
     * @param maxParentHops number of parent rounds after the initial lookup, or
     *                      {@link #UNLIMITED}
     */
    public ParentClosure(Function<List<EntityUid>, Uni<Map<String, ResolvedEntity>>> fetchRound, int maxParentHops) {
        if (maxParentHops < UNLIMITED) {
            throw new IllegalArgumentException("maxParentHops must be -1 or greater");
        }
        this.fetchRound = fetchRound;
        this.maxParentHops = maxParentHops;
    }

    public Uni<List<ResolvedEntity>> resolve(List<EntityUid> uids) {
        final Set<String> visited = new LinkedHashSet<>();
        final List<EntityUid> frontier = new ArrayList<>();
        for (final var uid : uids) {
            if (visited.add(uid.key())) {
                frontier.add(uid);
            }
        }
        return round(frontier, 0, visited, new LinkedHashMap<>())
                .map(found -> List.copyOf(found.values()));
    }

    private Uni<Map<String, ResolvedEntity>> round(
            List<EntityUid> frontier, int hop, Set<String> visited, Map<String, ResolvedEntity> found) {
        if (frontier.isEmpty()) {
            return Uni.createFrom().item(found);
        }
        return fetchRound.apply(frontier).flatMap(fetched -> {
            final List<EntityUid> next = new ArrayList<>();
            for (final var uid : frontier) {
                final var entity = fetched.get(uid.key());
                if (entity == null) {
                    continue;
                }
                found.putIfAbsent(entity.key(), entity);
                for (final var parent : entity.parents()) {
                    if (visited.add(parent.key())) {
                        next.add(parent);
                    }
                }
            }
            if (maxParentHops != UNLIMITED && hop >= maxParentHops) {
                return Uni.createFrom().item(found);
            }
            return round(next, hop + 1, visited, found);
        });
    }
}
