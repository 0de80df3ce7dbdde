package authzen.core.model;

/**
 * One entry of a batch evaluation. Any field may be null, in which case the batch-level
 * default applies.
 *
 * @param subject  subject override, or null
 * @param action   action override, or null
 * @param resource resource override, or null
 */
public record EvaluationItem(Entity subject, Action action, Entity resource) {}
