package sec.skeleton.api.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import sec.skeleton.api.exception.ConfigValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * EnvironmentConfigValidator
 * Validates the process environment before the application context is created.
 *
 * <p>Recognised variables:
 * <ul>
 *   <li>{@code APP_ENV} - development | production | test (default development)</li>
 *   <li>{@code PORT} - integer 1..65535 (default 3000)</li>
 *   <li>{@code API_KEY} - optional, any value</li>
 *   <li>{@code DATABASE_URL} - optional, absolute URI when non-empty</li>
 * </ul>
 * Defaults apply only when a variable is missing; APP_ENV or PORT set to an empty value is rejected.
 * Unknown variables are ignored. Every violated constraint is reported, not just the first.
 */
public class EnvironmentConfigValidator {

    public static final String APP_ENV = "APP_ENV";
    public static final String PORT = "PORT";
    public static final String API_KEY = "API_KEY";
    public static final String DATABASE_URL = "DATABASE_URL";

    public static final int DEFAULT_PORT = 3000;

    // EnvironmentSettings component -> environment variable
    private static final Map<String, String> VARIABLE_NAMES = Map.of(
            "appEnv", APP_ENV,
            "port", PORT,
            "apiKey", API_KEY,
            "databaseUrl", DATABASE_URL
    );

    private final Validator validator;

    public EnvironmentConfigValidator() {
        this(buildDefaultValidator());
    }

    public EnvironmentConfigValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Validates the given environment and applies defaults.
     *
     * @param env environment variables; {@code null} is treated as empty
     * @return normalized configuration
     * @throws ConfigValidationException listing every violated constraint
     */
    public AppConfig validate(Map<String, String> env) {
        Map<String, String> source = env != null ? env : Collections.emptyMap();
        Map<String, String> violations = new LinkedHashMap<>();

        String appEnv = valueOrDefault(source.get(APP_ENV), AppEnvironment.DEFAULT.value());
        Long port = parsePort(source.get(PORT), violations);

        EnvironmentSettings settings = new EnvironmentSettings(
                appEnv,
                port,
                source.get(API_KEY),
                source.get(DATABASE_URL)
        );

        for (ConstraintViolation<EnvironmentSettings> violation : validator.validate(settings)) {
            String property = violation.getPropertyPath().toString();
            String variable = VARIABLE_NAMES.getOrDefault(property, property);
            violations.merge(variable, violation.getMessage(), (a, b) -> a + "; " + b);
        }

        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }

        return new AppConfig(
                AppEnvironment.fromValue(settings.appEnv()),
                settings.port().intValue(),
                settings.apiKey(),
                settings.databaseUrl()
        );
    }

    /**
     * Parses PORT as a base-10 integer. Only a missing PORT means the default;
     * an empty or blank value is an error.
     * Returns {@code null} and records a violation when the value is not an integer.
     */
    private static Long parsePort(String raw, Map<String, String> violations) {
        if (raw == null) {
            return (long) DEFAULT_PORT;
        }
        if (raw.isBlank()) {
            violations.put(PORT, "PORT must not be empty");
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            violations.put(PORT, "PORT must be an integer");
            return null;
        }
    }

    private static String valueOrDefault(String raw, String defaultValue) {
        return raw == null ? defaultValue : raw;
    }

    private static Validator buildDefaultValidator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }
}
