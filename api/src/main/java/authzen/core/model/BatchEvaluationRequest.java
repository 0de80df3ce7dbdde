package authzen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch of evaluations sharing default subject, action, resource and context.
 *
 * @param subject     default subject, or null
 * @param action      default action, or null
 * @param resource    default resource, or null
 * @param context     context shared by every item, empty when absent
 * @param evaluations the items, in request order
 * @param semantics   short-circuit policy
 */
public record BatchEvaluationRequest(
        Entity subject,
        Action action,
        Entity resource,
        Map<String, Object> context,
        List<EvaluationItem> evaluations,
        EvaluationSemantics semantics) {

    public BatchEvaluationRequest {
        if (evaluations == null) {
            throw new IllegalArgumentException("evaluations is required");
        }
        evaluations = List.copyOf(evaluations);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (semantics == null) {
            semantics = EvaluationSemantics.EXECUTE_ALL;
        }
    }

    /**
     * Resolve an item against the batch defaults.
     *
     * <p>Each field falls back independently: the item's value if present, else the
     * batch default, else an empty placeholder.
     *
     * @param item one of {@link #evaluations()}
     * @return the effective single evaluation
     */
    public EvaluationRequest effective(EvaluationItem item) {
        return new EvaluationRequest(
                firstNonNull(item.subject(), subject, Entity.placeholder()),
                firstNonNull(item.action(), action, Action.placeholder()),
                firstNonNull(item.resource(), resource, Entity.placeholder()),
                context);
    }

    /**
     * Subjects and resources named anywhere in the batch, defaults first, then each
     * item's subject and resource in request order.
     *
     * @return request entities, possibly with repeats
     */
    public List<Entity> referencedEntities() {
        final List<Entity> entities = new ArrayList<>();
        if (subject != null) {
            entities.add(subject);
        }
        if (resource != null) {
            entities.add(resource);
        }
        for (final var item : evaluations) {
            if (item.subject() != null) {
                entities.add(item.subject());
            }
            if (item.resource() != null) {
                entities.add(item.resource());
            }
        }
        return entities;
    }

    private static <T> T firstNonNull(T first, T second, T fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }
}
