package authzen.adapter.out.provider;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;

import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * MicroProfile Config implementation of ProviderConfig.
 */
@ApplicationScoped
public class MicroProfileProviderConfig implements ProviderConfig {

    private final Config config;

    @Inject
    public MicroProfileProviderConfig(Config config) {
        this.config = config;
    }

    @Override
    public String getRequired(String key) {
        return get(key).orElseThrow(() -> new ProviderException("Required configuration not found: " + key));
    }

    @Override
    public Optional<String> get(String key) {
        return config.getOptionalValue(key, String.class).filter(value -> !value.isBlank());
    }

    @Override
    public String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    @Override
    public Optional<Integer> getInt(String key) {
        return config.getOptionalValue(key, Integer.class);
    }
}
