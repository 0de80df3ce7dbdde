package authzen.adapter.in.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

import com.fasterxml.jackson.annotation.JsonInclude;

import authzen.core.model.Action;

/**
 * AuthZEN action. Also the result element of an action search.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionDto(@NotNull(message = "name is required") String name, Map<String, Object> properties) {

    public Action toModel() {
        return new Action(name, properties);
    }

    public static ActionDto named(String name) {
        return new ActionDto(name, null);
    }

    static Action toModelOrNull(ActionDto dto) {
        return dto != null ? dto.toModel() : null;
    }
}
