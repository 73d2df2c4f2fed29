package sec.skeleton.api.config;

import java.util.Arrays;

/**
 * AppEnvironment
 * Runtime environment the service is started in (APP_ENV).
 */
public enum AppEnvironment {

    DEVELOPMENT("development"),
    PRODUCTION("production"),
    TEST("test");

    public static final AppEnvironment DEFAULT = DEVELOPMENT;

    private final String value;

    AppEnvironment(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves an APP_ENV value. Matching is case-sensitive.
     *
     * @throws IllegalArgumentException if the value is not one of the known environments
     */
    public static AppEnvironment fromValue(String value) {
        return Arrays.stream(values())
                .filter(env -> env.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown environment: " + value));
    }
}
