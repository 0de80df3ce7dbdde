package authzen.adapter.out.entity.memory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import authzen.adapter.out.entity.CedarEntityJson;
import authzen.adapter.out.entity.CedarSchemaReader;
import authzen.core.model.CedarSchema;
import authzen.core.port.out.EntityProvider;
import authzen.core.service.ParentClosure;
import authzen.spi.EntityProviderFactory;
import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * Entity provider backed by a {@code cedarentities.json} file.
 *
 * <p>Configuration:
 * <ul>
 *   <li>{@code authzen.entities.memory.path} - the entities file, or a directory containing
 *       {@code cedarentities.json} and optionally a {@code cedarschema} (Cedar syntax) or
 *       {@code cedarschema.json} schema</li>
 *   <li>{@code authzen.entities.schema-path} - Cedar schema file, overrides the directory's schema</li>
 *   <li>{@code authzen.entities.parent-hops} - parent rounds, -1 for the full closure</li>
 * </ul>
 */
public class InMemoryEntityProviderFactory implements EntityProviderFactory {

    private static final Logger LOG = Logger.getLogger(InMemoryEntityProviderFactory.class);

    static final String PATH_KEY = "authzen.entities.memory.path";
    static final String PARENT_HOPS_KEY = "authzen.entities.parent-hops";
    static final String ENTITIES_FILE = "cedarentities.json";

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public String description() {
        return "In-memory entities loaded from " + ENTITIES_FILE;
    }

    @Override
    public int priority() {
        return 0; // Lowest priority, used as fallback
    }

    @Override
    public boolean isAvailable(ProviderConfig config) {
        return config.get(PATH_KEY).map(Path::of).map(InMemoryEntityProviderFactory::entitiesFile)
                .filter(Files::isRegularFile)
                .isPresent();
    }

    @Override
    public EntityProvider create(ProviderConfig config) {
        final var configured = Path.of(config.getRequired(PATH_KEY));
        final var entitiesFile = entitiesFile(configured);
        final int parentHops = config.getInt(PARENT_HOPS_KEY).orElse(ParentClosure.UNLIMITED);

        try (InputStream in = Files.newInputStream(entitiesFile)) {
            final var entities = new CedarEntityJson(mapper).readEntities(in);
            final var provider = new InMemoryEntityProvider(entities, loadSchema(configured, config), parentHops);
            LOG.infof("Loaded %d entities from %s", provider.size(), entitiesFile);
            return provider;
        } catch (IOException | IllegalArgumentException e) {
            throw new ProviderException("Failed to load entities from " + entitiesFile, e);
        }
    }

    private CedarSchema loadSchema(Path configured, ProviderConfig config) {
        final var reader = new CedarSchemaReader(mapper);
        if (config.get(CedarSchemaReader.SCHEMA_PATH_KEY).isPresent() || !Files.isDirectory(configured)) {
            return reader.load(config);
        }
        return reader.loadDirectory(configured);
    }

    private static Path entitiesFile(Path configured) {
        return Files.isDirectory(configured) ? configured.resolve(ENTITIES_FILE) : configured;
    }
}
