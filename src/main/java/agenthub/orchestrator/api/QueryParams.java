package agenthub.orchestrator.api;

import agenthub.orchestrator.error.ValidationException;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.util.List;
import java.util.Map;

/**
 * Typed access to query string parameters. Out-of-range or malformed values
 * are reported as validation errors on the parameter name.
 */
public final class QueryParams {

    private final Map<String, List<String>> params;

    private QueryParams(Map<String, List<String>> params) {
        this.params = params;
    }

    public static QueryParams of(String uri) {
        return new QueryParams(new QueryStringDecoder(uri).parameters());
    }

    /** First value of the parameter, or null when absent or blank */
    public String string(String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(0).trim();
        return value.isEmpty() ? null : value;
    }

    public int intValue(String name, int defaultValue, int min, int max) {
        String raw = string(name);
        if (raw == null) {
            return defaultValue;
        }
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(name, "must be an integer");
        }
        if (value < min || value > max) {
            throw new ValidationException(name, "must be between " + min + " and " + max);
        }
        return value;
    }

    public double doubleValue(String name, double defaultValue, double min, double max) {
        String raw = string(name);
        if (raw == null) {
            return defaultValue;
        }
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(name, "must be a number");
        }
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(name, "must be between " + min + " and " + max);
        }
        return value;
    }

    public boolean bool(String name) {
        String raw = string(name);
        if (raw == null) {
            return false;
        }
        return switch (raw.toLowerCase()) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new ValidationException(name, "must be true or false");
        };
    }
}
