package sec.skeleton.api.model.response;

/**
 * HealthStatus - body of GET /health.
 * Serialized as {"status":"ok"}.
 */
public record HealthStatus(
    String status
) {

    public static final String OK = "ok";

    public static HealthStatus ok() {
        return new HealthStatus(OK);
    }
}
