package authzen.adapter.out.entity.dynamodb;

import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromBool;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromL;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromM;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromN;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromNul;
import static software.amazon.awssdk.services.dynamodb.model.AttributeValue.fromS;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

/**
 * Converts entities to and from DynamoDB items.
 *
 * <p>Item layout:
 * <ul>
 *   <li>{@code PK} (S) - entity type</li>
 *   <li>{@code SK} (S) - entity id</li>
 *   <li>{@code GSISK} (S) - canonical entity key, {@code type::"id"}</li>
 *   <li>{@code attrs} (M) - Cedar attribute values</li>
 *   <li>{@code parents} (L of M) - parent uids as {@code {type, id}}</li>
 *   <li>{@code tags} (M) - entity tags, omitted when empty</li>
 * </ul>
 */
public final class EntityItemMapper {

    static final String COL_TYPE = "PK";
    static final String COL_ID = "SK";
    static final String COL_KEY = "GSISK";
    static final String COL_ATTRS = "attrs";
    static final String COL_PARENTS = "parents";
    static final String COL_TAGS = "tags";

    private EntityItemMapper() {}

    public static Map<String, AttributeValue> key(EntityUid uid) {
        return Map.of(COL_TYPE, fromS(uid.type()), COL_ID, fromS(uid.id()));
    }

    public static Map<String, AttributeValue> toItem(ResolvedEntity entity) {
        final Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put(COL_TYPE, fromS(entity.uid().type()));
        item.put(COL_ID, fromS(entity.uid().id()));
        item.put(COL_KEY, fromS(entity.key()));
        item.put(COL_ATTRS, fromM(toAttributeMap(entity.attrs())));
        item.put(
                COL_PARENTS,
                fromL(entity.parents().stream()
                        .map(parent -> fromM(Map.of("type", fromS(parent.type()), "id", fromS(parent.id()))))
                        .toList()));
        if (!entity.tags().isEmpty()) {
            item.put(COL_TAGS, fromM(toAttributeMap(entity.tags())));
        }
        return item;
    }

    /**
     * @throws IllegalArgumentException if the item has no type or id
     */
    public static ResolvedEntity fromItem(Map<String, AttributeValue> item) {
        final var type = item.get(COL_TYPE);
        final var id = item.get(COL_ID);
        if (type == null || type.s() == null || id == null || id.s() == null) {
            throw new IllegalArgumentException("Entity item requires string PK and SK");
        }

        final List<EntityUid> parents = new ArrayList<>();
        final var parentsValue = item.get(COL_PARENTS);
        if (parentsValue != null && parentsValue.hasL()) {
            for (final var parent : parentsValue.l()) {
                parents.add(parentUid(parent));
            }
        }

        return new ResolvedEntity(
                EntityUid.of(type.s(), id.s()),
                fromAttributeMap(item.get(COL_ATTRS)),
                parents,
                fromAttributeMap(item.get(COL_TAGS)));
    }

    static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return fromNul(true);
        }
        if (value instanceof String s) {
            return fromS(s);
        }
        if (value instanceof Boolean b) {
            return fromBool(b);
        }
        if (value instanceof Number n) {
            return fromN(n.toString());
        }
        if (value instanceof List<?> list) {
            return fromL(list.stream().map(EntityItemMapper::toAttributeValue).toList());
        }
        if (value instanceof Map<?, ?> map) {
            final Map<String, AttributeValue> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> converted.put(String.valueOf(k), toAttributeValue(v)));
            return fromM(converted);
        }
        throw new IllegalArgumentException("Unsupported attribute value type: " + value.getClass().getName());
    }

    static Object fromAttributeValue(AttributeValue value) {
        return switch (value.type()) {
            case S -> value.s();
            case N -> number(value.n());
            case BOOL -> value.bool();
            case NUL -> null;
            case L -> value.l().stream().map(EntityItemMapper::fromAttributeValue).toList();
            case M -> fromAttributeMap(value);
            case SS -> List.copyOf(value.ss());
            case NS -> value.ns().stream().map(EntityItemMapper::number).toList();
            default -> throw new IllegalArgumentException("Unsupported DynamoDB attribute type: " + value.type());
        };
    }

    private static Map<String, AttributeValue> toAttributeMap(Map<String, Object> values) {
        final Map<String, AttributeValue> converted = new LinkedHashMap<>();
        values.forEach((k, v) -> converted.put(k, toAttributeValue(v)));
        return converted;
    }

    private static Map<String, Object> fromAttributeMap(AttributeValue value) {
        if (value == null || !value.hasM()) {
            return Map.of();
        }
        // LinkedHashMap: attribute values may be null (NUL)
        final Map<String, Object> converted = new LinkedHashMap<>();
        value.m().forEach((k, v) -> converted.put(k, fromAttributeValue(v)));
        return converted;
    }

    private static EntityUid parentUid(AttributeValue parent) {
        if (!parent.hasM()) {
            throw new IllegalArgumentException("Parent must be a map of type and id");
        }
        var uid = parent.m();
        final var wrapped = uid.get("__entity");
        if (wrapped != null && wrapped.hasM()) {
            uid = wrapped.m();
        }
        final var type = uid.get("type");
        final var id = uid.get("id");
        if (type == null || type.s() == null || id == null || id.s() == null) {
            throw new IllegalArgumentException("Parent requires string type and id");
        }
        return EntityUid.of(type.s(), id.s());
    }

    private static Object number(String n) {
        try {
            return Long.parseLong(n);
        } catch (NumberFormatException e) {
            return new BigDecimal(n);
        }
    }
}
