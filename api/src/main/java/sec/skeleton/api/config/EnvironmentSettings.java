package sec.skeleton.api.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * EnvironmentSettings - raw environment values after defaults are applied,
 * before they are turned into an {@link AppConfig}.
 * Constraint messages name the environment variable they refer to.
 */
record EnvironmentSettings(

    @NotNull(message = "APP_ENV is required")
    @Pattern(regexp = "development|production|test",
             message = "APP_ENV must be one of [development, production, test]")
    String appEnv,

    // null when PORT could not be parsed; the parse error is reported separately
    @Min(value = 1, message = "PORT must be greater than or equal to 1")
    @Max(value = 65535, message = "PORT must be less than or equal to 65535")
    Long port,

    String apiKey,

    @WellFormedUri(message = "DATABASE_URL must be a valid uri")
    String databaseUrl
) {}
