package authzen.adapter.out.provider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

import org.jboss.logging.Logger;

import authzen.spi.NamedProvider;
import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * Picks one provider among those discovered via ServiceLoader.
 *
 * <p>Provider selection:
 * <ol>
 *   <li>If a provider name is configured, use that provider</li>
 *   <li>Otherwise, select the highest priority available provider</li>
 * </ol>
 */
final class ProviderSelector {

    private static final Logger LOG = Logger.getLogger(ProviderSelector.class);

    private ProviderSelector() {}

    static <T extends NamedProvider> T load(Class<T> type, Optional<String> configured, ProviderConfig config) {
        final List<T> providers = new ArrayList<>();
        ServiceLoader.load(type).forEach(providers::add);

        if (providers.isEmpty()) {
            throw new ProviderException("No " + type.getSimpleName() + " implementations found on the classpath");
        }

        LOG.infof(
                "Found %d %s(s): %s",
                providers.size(),
                type.getSimpleName(),
                providers.stream().map(NamedProvider::name).toList());

        return select(providers, configured.orElse(null), config, type.getSimpleName());
    }

    static <T extends NamedProvider> T select(List<T> providers, String configured, ProviderConfig config, String kind) {
        if (configured != null && !configured.isBlank()) {
            return providers.stream()
                    .filter(p -> p.name().equals(configured))
                    .findFirst()
                    .orElseThrow(() -> new ProviderException("Configured " + kind + " not found: " + configured
                            + ". Available: "
                            + providers.stream().map(NamedProvider::name).toList()));
        }

        return providers.stream()
                .filter(p -> p.isAvailable(config))
                .max(Comparator.comparingInt(NamedProvider::priority))
                .orElseThrow(() -> new ProviderException("No available " + kind + "; configure one explicitly"));
    }
}
