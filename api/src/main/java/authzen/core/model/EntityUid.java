package authzen.core.model;

/**
 * Identity of an entity: its type name and id.
 *
 * <p>Two entities with the same {@link #key()} are the same entity. The key follows the
 * Cedar entity UID literal syntax ({@code type::"id"}) with backslashes and double quotes
 * in the id escaped, so it is unambiguous for any id.
 *
 * @param type the entity type name (e.g., "identity", "route")
 * @param id   the entity id within its type
 */
public record EntityUid(String type, String id) {

    public EntityUid {
        if (type == null) {
            throw new IllegalArgumentException("Entity type cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("Entity id cannot be null");
        }
    }

    public static EntityUid of(String type, String id) {
        return new EntityUid(type, id);
    }

    /**
     * Canonical key used for lookup and deduplication.
     *
     * @return the key in {@code type::"id"} form
     */
    public String key() {
        return key(type, id);
    }

    public static String key(String type, String id) {
        final var escaped = id.replace("\\", "\\\\").replace("\"", "\\\"");
        return type + "::\"" + escaped + "\"";
    }

    @Override
    public String toString() {
        return key();
    }
}
