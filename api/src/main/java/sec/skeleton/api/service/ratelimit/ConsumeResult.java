package sec.skeleton.api.service.ratelimit;

/**
 * ConsumeResult - outcome of a single rate limit check.
 *
 * @param allowed          whether the request may proceed
 * @param limit            bucket capacity (requests per window)
 * @param remaining        tokens left after this request
 * @param resetSeconds     seconds until the bucket is refilled
 */
public record ConsumeResult(boolean allowed, long limit, long remaining, long resetSeconds) {

    public static ConsumeResult allowed(long limit, long remaining, long resetSeconds) {
        return new ConsumeResult(true, limit, remaining, resetSeconds);
    }

    public static ConsumeResult denied(long limit, long resetSeconds) {
        return new ConsumeResult(false, limit, 0L, resetSeconds);
    }

    /**
     * Value for the Retry-After header; never less than one second.
     */
    public long retryAfterSeconds() {
        return Math.max(resetSeconds, 1L);
    }
}
