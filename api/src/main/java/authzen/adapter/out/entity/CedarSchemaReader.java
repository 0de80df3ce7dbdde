package authzen.adapter.out.entity;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.cedarpolicy.model.schema.Schema;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import authzen.core.model.CedarSchema;
import authzen.spi.ProviderConfig;
import authzen.spi.ProviderException;

/**
 * Reads the action section of a Cedar schema.
 *
 * <p>Files ending in {@code .json} are read as JSON schemas ({@code cedarschema.json}), any
 * other file as the human-readable Cedar schema syntax ({@code cedarschema}), which is
 * converted to JSON first. The schema must declare exactly one namespace. Only the
 * {@code appliesTo} principal and resource types of each action are kept.
 */
public final class CedarSchemaReader {

    private static final Logger LOG = Logger.getLogger(CedarSchemaReader.class);

    public static final String SCHEMA_PATH_KEY = "authzen.entities.schema-path";
    public static final String CEDAR_SCHEMA_FILE = "cedarschema";
    public static final String JSON_SCHEMA_FILE = "cedarschema.json";

    private final ObjectMapper mapper;

    public CedarSchemaReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Load the schema named by {@value #SCHEMA_PATH_KEY}, or the empty schema when unset.
     *
     * @throws ProviderException if the file cannot be read or parsed
     */
    public CedarSchema load(ProviderConfig config) {
        final Optional<String> schemaPath = config.get(SCHEMA_PATH_KEY);
        if (schemaPath.isEmpty()) {
            LOG.info("No Cedar schema configured; action search returns no actions");
            return CedarSchema.empty();
        }
        return loadFile(Path.of(schemaPath.get()));
    }

    /**
     * Load the schema of a directory, preferring {@value #CEDAR_SCHEMA_FILE} over
     * {@value #JSON_SCHEMA_FILE}; the empty schema when it has neither.
     *
     * @throws ProviderException if the file cannot be read or parsed
     */
    public CedarSchema loadDirectory(Path directory) {
        for (final var name : new String[] {CEDAR_SCHEMA_FILE, JSON_SCHEMA_FILE}) {
            final var file = directory.resolve(name);
            if (Files.isRegularFile(file)) {
                return loadFile(file);
            }
        }
        LOG.infof("No Cedar schema in %s; action search returns no actions", directory);
        return CedarSchema.empty();
    }

    /**
     * @throws ProviderException if the file cannot be read or parsed
     */
    public CedarSchema loadFile(Path path) {
        try {
            final var schema = isJson(path)
                    ? readJsonFile(path)
                    : readCedar(Files.readString(path, StandardCharsets.UTF_8));
            LOG.infof(
                    "Loaded Cedar schema %s: namespace '%s', %d actions",
                    path, schema.namespace(), schema.actions().size());
            return schema;
        } catch (IOException e) {
            throw new ProviderException("Failed to read Cedar schema " + path, e);
        }
    }

    /**
     * Read a schema written in the Cedar schema syntax.
     *
     * @throws ProviderException if the text is not a valid Cedar schema
     */
    public CedarSchema readCedar(String text) throws IOException {
        final String json;
        try {
            json = String.valueOf(Schema.parse(Schema.JsonOrCedar.Cedar, text).toJsonFormat());
        } catch (Exception e) {
            throw new ProviderException("Invalid Cedar schema: " + e.getMessage(), e);
        }
        return read(mapper.readTree(json));
    }

    public CedarSchema read(InputStream in) throws IOException {
        return read(mapper.readTree(in));
    }

    private CedarSchema readJsonFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    private CedarSchema read(JsonNode root) {
        if (root == null || !root.isObject() || root.size() != 1) {
            throw new ProviderException("Cedar schema must declare exactly one namespace");
        }
        final var namespace = root.fieldNames().next();
        final var actionsNode = root.get(namespace).path("actions");

        final Map<String, CedarSchema.AppliesTo> actions = new LinkedHashMap<>();
        actionsNode.fields().forEachRemaining(entry -> {
            final var appliesTo = entry.getValue().path("appliesTo");
            actions.put(
                    entry.getKey(),
                    new CedarSchema.AppliesTo(
                            textSet(appliesTo.path("principalTypes")), textSet(appliesTo.path("resourceTypes"))));
        });
        return new CedarSchema(namespace, actions);
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().endsWith(".json");
    }

    private static Set<String> textSet(JsonNode array) {
        final Set<String> values = new LinkedHashSet<>();
        array.forEach(value -> values.add(value.asText()));
        return values;
    }
}
