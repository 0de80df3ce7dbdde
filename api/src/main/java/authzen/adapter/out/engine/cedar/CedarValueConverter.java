package authzen.adapter.out.engine.cedar;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cedarpolicy.model.entity.Entity;
import com.cedarpolicy.value.CedarList;
import com.cedarpolicy.value.CedarMap;
import com.cedarpolicy.value.Decimal;
import com.cedarpolicy.value.EntityTypeName;
import com.cedarpolicy.value.EntityUID;
import com.cedarpolicy.value.IpAddress;
import com.cedarpolicy.value.PrimBool;
import com.cedarpolicy.value.PrimLong;
import com.cedarpolicy.value.PrimString;
import com.cedarpolicy.value.Value;
import org.jboss.logging.Logger;

import authzen.core.model.EntityUid;
import authzen.core.model.ResolvedEntity;

/**
 * Converts Cedar JSON style values and entities to cedar-java values.
 *
 * <p>Records of the form {@code {"__entity": {"type", "id"}}} become entity references,
 * {@code {"__extn": {"fn": "ip"|"decimal", "arg"}}} become extension values. Null record
 * fields are dropped.
 */
final class CedarValueConverter {

    private static final Logger LOG = Logger.getLogger(CedarValueConverter.class);

    private CedarValueConverter() {}

    /**
     * @return the cedar-java uid, or null when the type is not a valid Cedar entity type name
     */
    static EntityUID toUid(EntityUid uid) {
        return EntityTypeName.parse(uid.type())
                .map(type -> new EntityUID(type, uid.id()))
                .orElse(null);
    }

    /**
     * Entities and parents whose type is not a valid Cedar entity type name are left out;
     * a query naming one is then denied by the engine.
     */
    static Set<Entity> toEntities(List<ResolvedEntity> entities) {
        final Set<Entity> result = new HashSet<>();
        for (final var entity : entities) {
            final var uid = toUid(entity.uid());
            if (uid == null) {
                LOG.debugf("Skipping entity with invalid Cedar type: %s", entity.uid());
                continue;
            }
            final Set<EntityUID> parents = new HashSet<>();
            for (final var parent : entity.parents()) {
                final var parentUid = toUid(parent);
                if (parentUid == null) {
                    LOG.debugf("Skipping parent with invalid Cedar type: %s of %s", parent, entity.uid());
                } else {
                    parents.add(parentUid);
                }
            }
            result.add(new Entity(uid, toRecord(entity.attrs()), parents));
        }
        return result;
    }

    static Map<String, Value> toRecord(Map<String, Object> values) {
        final Map<String, Value> record = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (value != null) {
                record.put(name, toValue(value));
            }
        });
        return record;
    }

    static Value toValue(Object value) {
        if (value instanceof String s) {
            return new PrimString(s);
        }
        if (value instanceof Boolean b) {
            return new PrimBool(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new PrimLong(((Number) value).longValue());
        }
        if (value instanceof BigInteger i) {
            return new PrimLong(requireLong(new BigDecimal(i)));
        }
        if (value instanceof Number n) {
            final var decimal = new BigDecimal(n.toString());
            if (decimal.stripTrailingZeros().scale() <= 0) {
                return new PrimLong(requireLong(decimal));
            }
            return new Decimal(decimal.toPlainString());
        }
        if (value instanceof List<?> list) {
            final List<Value> values = new ArrayList<>();
            list.stream().filter(v -> v != null).forEach(v -> values.add(toValue(v)));
            return new CedarList(values);
        }
        if (value instanceof Map<?, ?> map) {
            return toRecordOrEscape(map);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    private static Value toRecordOrEscape(Map<?, ?> map) {
        if (map.size() == 1 && map.get("__entity") instanceof Map<?, ?> ref) {
            return requireUid(EntityUid.of(String.valueOf(ref.get("type")), String.valueOf(ref.get("id"))));
        }
        if (map.size() == 1 && map.get("__extn") instanceof Map<?, ?> extn) {
            final var fn = String.valueOf(extn.get("fn"));
            final var arg = String.valueOf(extn.get("arg"));
            return switch (fn) {
                case "ip", "ipaddr" -> new IpAddress(arg);
                case "decimal" -> new Decimal(arg);
                default -> throw new IllegalArgumentException("Unsupported extension function: " + fn);
            };
        }
        final Map<String, Value> record = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v != null) {
                record.put(String.valueOf(k), toValue(v));
            }
        });
        return new CedarMap(record);
    }

    private static long requireLong(BigDecimal value) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Integer out of range for Cedar: " + value.toPlainString(), e);
        }
    }

    private static EntityUID requireUid(EntityUid uid) {
        final var converted = toUid(uid);
        if (converted == null) {
            throw new IllegalArgumentException("Invalid Cedar entity type: '" + uid.type() + "'");
        }
        return converted;
    }
}
