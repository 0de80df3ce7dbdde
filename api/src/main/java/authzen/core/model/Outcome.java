package authzen.core.model;

/**
 * Decision reported by the backing policy engine.
 */
public enum Outcome {
    ALLOW,
    DENY
}
