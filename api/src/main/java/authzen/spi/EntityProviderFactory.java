package authzen.spi;

import authzen.core.port.out.EntityProvider;

/**
 * Service Provider Interface for entity data providers (policy information points).
 *
 * <p>Implementations are discovered via java.util.ServiceLoader at startup.
 *
 * <h2>How to Create a Custom Provider</h2>
 * <ol>
 *   <li>Implement this interface</li>
 *   <li>Create META-INF/services/authzen.spi.EntityProviderFactory</li>
 *   <li>Add your fully qualified class name to the file</li>
 *   <li>Configure: authzen.entities.provider=your-provider-name</li>
 * </ol>
 *
 * <p>Built-in providers use priority 0 (memory) and 10 (dynamodb).
 */
public interface EntityProviderFactory extends NamedProvider {

    /**
     * Create the entity provider.
     *
     * <p>Called once at startup. The returned instance must be thread-safe.
     *
     * @param config Access to configuration properties
     * @return Entity provider implementation
     * @throws ProviderException if initialization fails
     */
    EntityProvider create(ProviderConfig config);
}
