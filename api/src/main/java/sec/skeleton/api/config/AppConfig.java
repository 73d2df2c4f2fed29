package sec.skeleton.api.config;

/**
 * AppConfig - validated, read-only process configuration.
 * Built once at startup by {@link EnvironmentConfigValidator}.
 */
public record AppConfig(
    AppEnvironment environment,
    int port,
    String apiKey,       // may be null or empty
    String databaseUrl   // may be null or empty, otherwise an absolute URI
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isEmpty();
    }

    public boolean hasDatabaseUrl() {
        return databaseUrl != null && !databaseUrl.isEmpty();
    }

    /**
     * Secrets are masked so the record can be logged safely.
     */
    @Override
    public String toString() {
        return "AppConfig[environment=" + environment.value()
                + ", port=" + port
                + ", apiKey=" + (hasApiKey() ? "****" : "<unset>")
                + ", databaseUrl=" + (hasDatabaseUrl() ? "****" : "<unset>") + "]";
    }
}
