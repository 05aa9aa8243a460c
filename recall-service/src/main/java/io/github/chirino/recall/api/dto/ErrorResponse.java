package io.github.chirino.recall.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;

/**
 * JSON error body.
 *
 * @param code stable machine-readable identifier such as {@code not_found}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String code, Map<String, Object> details) {

    public ErrorResponse(String error, String code) {
        this(error, code, null);
    }
}
