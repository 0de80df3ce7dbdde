package authzen.spi;

import authzen.core.port.out.DecisionEngine;

/**
 * Service Provider Interface for decision engines.
 *
 * <p>Implementations are discovered via java.util.ServiceLoader at startup and
 * registered in META-INF/services/authzen.spi.DecisionEngineProvider. Select one with
 * {@code authzen.engine.provider}; otherwise the available engine with the highest
 * priority is used.
 */
public interface DecisionEngineProvider extends NamedProvider {

    /**
     * Create the decision engine, loading its policies.
     *
     * @param config Access to configuration properties
     * @return Decision engine implementation
     * @throws ProviderException if initialization fails
     */
    DecisionEngine create(ProviderConfig config);
}
