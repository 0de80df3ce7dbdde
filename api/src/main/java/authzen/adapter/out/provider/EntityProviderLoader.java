package authzen.adapter.out.provider;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import authzen.core.port.out.EntityProvider;
import authzen.spi.EntityProviderFactory;
import authzen.spi.ProviderConfig;

/**
 * Discovers entity provider factories and produces the {@link EntityProvider} bean.
 *
 * <p>Uses {@code authzen.entities.provider} when set, otherwise the highest priority
 * available factory.
 */
@ApplicationScoped
public class EntityProviderLoader {

    private static final Logger LOG = Logger.getLogger(EntityProviderLoader.class);

    private final Optional<String> configuredProvider;
    private final ProviderConfig config;

    @Inject
    public EntityProviderLoader(
            @ConfigProperty(name = "authzen.entities.provider") Optional<String> configuredProvider,
            ProviderConfig config) {
        this.configuredProvider = configuredProvider;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public EntityProvider entityProvider() {
        final var factory = ProviderSelector.load(EntityProviderFactory.class, configuredProvider, config);
        LOG.infof("Creating entity provider: %s (%s)", factory.name(), factory.description());
        return factory.create(config);
    }
}
