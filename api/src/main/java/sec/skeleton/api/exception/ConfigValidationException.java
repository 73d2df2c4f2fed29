package sec.skeleton.api.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ConfigValidationException
 * Thrown at startup when one or more environment variables are invalid.
 * Fatal: the application must not start.
 */
@Getter
public class ConfigValidationException extends RuntimeException {

    /**
     * Environment variable name -> reason, in the order they were detected.
     */
    private final Map<String, String> violations;

    public ConfigValidationException(Map<String, String> violations) {
        super(describe(violations));
        this.violations = Collections.unmodifiableMap(new LinkedHashMap<>(violations));
    }

    private static String describe(Map<String, String> violations) {
        return "Config validation error: " + violations.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
