package authzen.adapter.out.provider;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import authzen.core.port.out.DecisionEngine;
import authzen.spi.DecisionEngineProvider;
import authzen.spi.ProviderConfig;

/**
 * Discovers decision engine providers and produces the {@link DecisionEngine} bean.
 *
 * <p>Uses {@code authzen.engine.provider} when set, otherwise the highest priority
 * available engine.
 */
@ApplicationScoped
public class DecisionEngineLoader {

    private static final Logger LOG = Logger.getLogger(DecisionEngineLoader.class);

    private final Optional<String> configuredEngine;
    private final ProviderConfig config;

    @Inject
    public DecisionEngineLoader(
            @ConfigProperty(name = "authzen.engine.provider") Optional<String> configuredEngine,
            ProviderConfig config) {
        this.configuredEngine = configuredEngine;
        this.config = config;
    }

    @Produces
    @ApplicationScoped
    public DecisionEngine decisionEngine() {
        final var provider = ProviderSelector.load(DecisionEngineProvider.class, configuredEngine, config);
        LOG.infof("Creating decision engine: %s (%s)", provider.name(), provider.description());
        return provider.create(config);
    }
}
