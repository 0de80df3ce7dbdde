package authzen.adapter.out.entity;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

/**
 * Reads and writes entities in the Cedar JSON entity format.
 *
 * <pre>
 * {"uid": {"type": "group", "id": "editors"},
 *  "attrs": {"owner": {"__entity": {"type": "identity", "id": "alice"}}},
 *  "parents": [{"type": "group", "id": "viewers"}],
 *  "tags": {}}
 * </pre>
 *
 * <p>Entity uids may be written bare or wrapped in {@code __entity}. Attribute values are
 * kept as plain Java values (maps, lists, strings, numbers, booleans) with entity
 * references and extension values left in their JSON form.
 */
public final class CedarEntityJson {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CedarEntityJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<ResolvedEntity> readEntities(InputStream in) throws IOException {
        final var root = mapper.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("Cedar entities document must be a JSON array");
        }
        final List<ResolvedEntity> entities = new ArrayList<>();
        for (final var node : root) {
            if (node.hasNonNull("uid")) {
                entities.add(readEntity(node));
            }
        }
        return entities;
    }

    public ResolvedEntity readEntity(JsonNode node) {
        final var uid = readUid(node.get("uid"));
        final List<EntityUid> parents = new ArrayList<>();
        final var parentsNode = node.get("parents");
        if (parentsNode != null && parentsNode.isArray()) {
            parentsNode.forEach(parent -> parents.add(readUid(parent)));
        }
        return new ResolvedEntity(uid, readMap(node.get("attrs")), parents, readMap(node.get("tags")));
    }

    /**
     * Read an entity uid, bare ({@code {"type","id"}}) or wrapped in {@code __entity}.
     *
     * @throws IllegalArgumentException if type or id is missing
     */
    public static EntityUid readUid(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Entity uid must be an object");
        }
        final var uid = node.has("__entity") ? node.get("__entity") : node;
        final var type = uid.get("type");
        final var id = uid.get("id");
        if (type == null || id == null || !type.isTextual() || !id.isTextual()) {
            throw new IllegalArgumentException("Entity uid requires string type and id: " + node);
        }
        return EntityUid.of(type.asText(), id.asText());
    }

    public ObjectNode writeUid(EntityUid uid) {
        final var node = mapper.createObjectNode();
        node.put("type", uid.type());
        node.put("id", uid.id());
        return node;
    }

    public ObjectNode writeEntity(ResolvedEntity entity) {
        final var node = mapper.createObjectNode();
        node.set("uid", writeUid(entity.uid()));
        node.set("attrs", mapper.valueToTree(entity.attrs()));
        final var parents = node.putArray("parents");
        entity.parents().forEach(parent -> parents.add(writeUid(parent)));
        if (!entity.tags().isEmpty()) {
            node.set("tags", mapper.valueToTree(entity.tags()));
        }
        return node;
    }

    public ArrayNode writeEntities(List<ResolvedEntity> entities) {
        final var array = mapper.createArrayNode();
        entities.forEach(entity -> array.add(writeEntity(entity)));
        return array;
    }

    public String toJsonString(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be written as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object but found " + node.getNodeType());
        }
        return mapper.convertValue(node, MAP_TYPE);
    }
}
