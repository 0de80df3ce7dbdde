package authzen.adapter.out.entity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import authzen.spi.MapProviderConfig;
import authzen.spi.ProviderException;

@DisplayName("CedarSchemaReader")
class CedarSchemaReaderTest {

    private final CedarSchemaReader reader = new CedarSchemaReader(new ObjectMapper());

    @Test
    @DisplayName("Should read the appliesTo types of each action")
    void shouldReadAppliesTo() throws Exception {
        final var schema = reader.read(json("""
                {"PhotoApp": {
                  "entityTypes": {},
                  "actions": {
                    "view": {"appliesTo": {"principalTypes": ["User"], "resourceTypes": ["Photo", "Album"]}},
                    "share": {"appliesTo": {"principalTypes": ["User"], "resourceTypes": ["Photo"]}},
                    "audit": {}
                  }
                }}
                """));

        assertEquals("PhotoApp", schema.namespace());
        assertEquals(Set.of("Photo", "Album"), schema.actions().get("view").resourceTypes());
        assertEquals(List.of("view", "share"), schema.applicableActions("User", "Photo"));
        assertEquals(List.of("view"), schema.applicableActions("User", "Album"));
        assertTrue(schema.actions().get("audit").principalTypes().isEmpty());
    }

    @Test
    @DisplayName("Should reject a schema with several namespaces")
    void shouldRejectSeveralNamespaces() {
        assertThrows(ProviderException.class, () -> reader.read(json("{\"A\": {}, \"B\": {}}")));
    }

    @Test
    @DisplayName("Should return the empty schema when no path is configured")
    void shouldReturnEmptySchemaWhenUnset() {
        final var schema = reader.load(MapProviderConfig.empty());

        assertTrue(schema.actions().isEmpty());
    }

    @Test
    @DisplayName("Should load the configured schema file")
    void shouldLoadConfiguredFile() {
        final var schema = reader.load(new MapProviderConfig(
                Map.of(CedarSchemaReader.SCHEMA_PATH_KEY, "src/test/resources/fixtures/cedarschema.json")));

        assertEquals("", schema.namespace());
        assertEquals(5, schema.actions().size());
    }

    @Test
    @DisplayName("Should read a schema written in the Cedar syntax")
    void shouldReadCedarSyntax() throws Exception {
        final var schema = reader.readCedar("""
                namespace PhotoApp {
                  entity User;
                  entity Album;
                  entity Photo in [Album];
                  action view appliesTo { principal: [User], resource: [Photo, Album] };
                  action share appliesTo { principal: [User], resource: [Photo] };
                }
                """);

        assertEquals("PhotoApp", schema.namespace());
        assertEquals(Set.of("view", "share"), Set.copyOf(schema.applicableActions("User", "Photo")));
        assertEquals(List.of("view"), schema.applicableActions("User", "Album"));
    }

    @Test
    @DisplayName("Should load a configured Cedar syntax schema file")
    void shouldLoadCedarSyntaxFile() {
        final var schema = reader.load(new MapProviderConfig(
                Map.of(CedarSchemaReader.SCHEMA_PATH_KEY, "src/test/resources/fixtures/cedar-syntax/cedarschema")));

        assertEquals("", schema.namespace());
        assertEquals(5, schema.actions().size());
        assertEquals(Set.of("GET", "POST", "DELETE"), Set.copyOf(schema.applicableActions("identity", "route")));
    }

    @Test
    @DisplayName("Should reject invalid Cedar syntax")
    void shouldRejectInvalidCedarSyntax() {
        assertThrows(ProviderException.class, () -> reader.readCedar("entity User in ;"));
    }

    @Test
    @DisplayName("Should return the empty schema for a directory without one")
    void shouldReturnEmptySchemaForBareDirectory(@TempDir Path dir) {
        assertTrue(reader.loadDirectory(dir).actions().isEmpty());
    }

    @Test
    @DisplayName("Should fail for a missing schema file")
    void shouldFailForMissingFile() {
        final var config = new MapProviderConfig(Map.of(CedarSchemaReader.SCHEMA_PATH_KEY, "does/not/exist.json"));

        assertThrows(ProviderException.class, () -> reader.load(config));
    }

    private static ByteArrayInputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
