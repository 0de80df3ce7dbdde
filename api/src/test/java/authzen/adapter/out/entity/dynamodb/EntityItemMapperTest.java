package authzen.adapter.out.entity.dynamodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromL;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromM;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromN;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromS;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromSs;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

@DisplayName("EntityItemMapper")
class EntityItemMapperTest {

    @Test
    @DisplayName("Should write the key columns and the canonical key")
    void shouldWriteKeyColumns() {
        final var entity = new ResolvedEntity(
                EntityUid.of("identity", "alice"),
                Map.of("department", "eng"),
                List.of(EntityUid.of("group", "editors")));

        final var item = EntityItemMapper.toItem(entity);

        assertEquals("identity", item.get("PK").s());
        assertEquals("alice", item.get("SK").s());
        assertEquals("identity::\"alice\"", item.get("GSISK").s());
        assertEquals("editors", item.get("parents").l().get(0).m().get("id").s());
        assertFalse(item.containsKey("tags"));
    }

    @Test
    @DisplayName("Should read an item written by toItem")
    void shouldReadWrittenItem() {
        final Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put("level", 3L);
        attrs.put("score", new BigDecimal("1.5"));
        attrs.put("roles", List.of("admin", "dev"));
        attrs.put("manager", Map.of("__entity", Map.of("type", "identity", "id", "bob")));
        attrs.put("active", true);
        final var entity = new ResolvedEntity(
                EntityUid.of("identity", "alice"), attrs, List.of(EntityUid.of("group", "editors")), Map.of("team", "core"));

        assertEquals(entity, EntityItemMapper.fromItem(EntityItemMapper.toItem(entity)));
    }

    @Test
    @DisplayName("Should accept parents wrapped in __entity and string sets")
    void shouldAcceptHandWrittenItems() {
        final Map<String, AttributeValue> item = Map.of(
                "PK", fromS("identity"),
                "SK", fromS("alice"),
                "attrs", fromM(Map.of("roles", fromSs(List.of("admin")), "age", fromN("42"))),
                "parents", fromL(List.of(fromM(Map.of(
                        "__entity", fromM(Map.of("type", fromS("group"), "id", fromS("editors"))))))));

        final var entity = EntityItemMapper.fromItem(item);

        assertEquals(List.of(EntityUid.of("group", "editors")), entity.parents());
        assertEquals(List.of("admin"), entity.attrs().get("roles"));
        assertEquals(42L, entity.attrs().get("age"));
        assertEquals(Map.of(), entity.tags());
    }

    @Test
    @DisplayName("Should keep null attribute values")
    void shouldKeepNullAttributes() {
        assertNull(EntityItemMapper.fromAttributeValue(AttributeValue.fromNul(true)));
    }

    @Test
    @DisplayName("Should reject an item without a sort key")
    void shouldRejectItemWithoutSortKey() {
        assertThrows(
                IllegalArgumentException.class, () -> EntityItemMapper.fromItem(Map.of("PK", fromS("identity"))));
    }
}
