package agenthub.orchestrator.api.v1.dto;

import agenthub.orchestrator.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error body: {@code {"error": {"code", "message", "fields"}}}.
 */
public record ErrorResponse(@JsonProperty("error") Body error) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Body(
            @JsonProperty("code") String code,
            @JsonProperty("message") String message,
            @JsonProperty("fields") List<Field> fields) {
    }

    public record Field(
            @JsonProperty("field") String field,
            @JsonProperty("message") String message) {
    }

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(new Body(code, message, List.of()));
    }

    public static ErrorResponse of(ValidationException e) {
        List<Field> fields = e.fieldErrors().stream()
                .map(f -> new Field(f.field(), f.message()))
                .toList();
        return new ErrorResponse(new Body(e.code(), "Request validation failed", fields));
    }
}
