package agenthub.orchestrator.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Malformed request. Never retried.
 */
public class ValidationException extends OrchestratorException {

    /** One invalid field and what is wrong with it */
    public record FieldError(String field, String message) {
    }

    private final List<FieldError> fieldErrors;

    public ValidationException(List<FieldError> fieldErrors) {
        super(describe(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldError(field, message)));
    }

    public List<FieldError> fieldErrors() {
        return fieldErrors;
    }

    @Override
    public String code() {
        return "VALIDATION_ERROR";
    }

    private static String describe(List<FieldError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("at least one field error is required");
        }
        return errors.stream()
                .map(e -> e.field() + ": " + e.message())
                .collect(Collectors.joining("; "));
    }
}
