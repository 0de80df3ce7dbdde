package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonInclude;

import authzen.core.model.Entity;

/**
 * AuthZEN subject or resource.
 *
 * <p>{@code id} is required for evaluations and optional for the searched entity of a
 * subject or resource search.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityDto(
        @NotNull(message = "type is required") String type, String id, Map<String, Object> properties) {

    /**
     * Convert this DTO to an Entity model.
     *
     * @throws IllegalArgumentException if the id is missing
     */
    public Entity toModel() {
        if (id == null) {
            throw new IllegalArgumentException("id is required for entity of type '" + type + "'");
        }
        return new Entity(type, id, properties);
    }

    public static EntityDto fromModel(Entity entity) {
        return new EntityDto(entity.type(), entity.id(), entity.properties());
    }

    static Entity toModelOrNull(EntityDto dto) {
        return dto != null ? dto.toModel() : null;
    }
}
