package sec.skeleton.api.service.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * ClientRateLimiter
 * Per-client fixed-window limiter: each client key gets a Bucket4j bucket holding
 * {@code maxRequests} tokens that is refilled in full once per {@code window}.
 *
 * <p>Buckets live in a bounded Caffeine cache. A bucket idle for a whole window is
 * full again anyway, so evicting it after that loses nothing.
 */
public class ClientRateLimiter {

    private final long maxRequests;
    private final Duration window;
    private final TimeMeter timeMeter;
    private final Cache<String, Bucket> buckets;

    public ClientRateLimiter(long maxRequests, Duration window, long maxClients) {
        this(maxRequests, window, maxClients, TimeMeter.SYSTEM_MILLISECONDS);
    }

    public ClientRateLimiter(long maxRequests, Duration window, long maxClients, TimeMeter timeMeter) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1, got " + maxRequests);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.timeMeter = timeMeter;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(maxClients)
                .expireAfterAccess(window)
                .build();
    }

    /**
     * Takes one token from the client's bucket.
     *
     * @param clientKey client identity, normally the source address
     */
    public ConsumeResult tryConsume(String clientKey) {
        Bucket bucket = buckets.get(clientKey, key -> newBucket());
        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            return ConsumeResult.allowed(maxRequests, probe.getRemainingTokens(),
                    toSeconds(probe.getNanosToWaitForReset()));
        }
        return ConsumeResult.denied(maxRequests, toSeconds(probe.getNanosToWaitForRefill()));
    }

    public long getMaxRequests() {
        return maxRequests;
    }

    public Duration getWindow() {
        return window;
    }

    /**
     * Number of clients currently tracked.
     */
    public long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private Bucket newBucket() {
        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(maxRequests)
                .refillIntervally(maxRequests, window)
                .build();

        return Bucket.builder()
                .addLimit(bandwidth)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    // rounds up so a client is never told to retry too early
    private static long toSeconds(long nanos) {
        if (nanos <= 0) {
            return 0L;
        }
        long seconds = TimeUnit.NANOSECONDS.toSeconds(nanos);
        return TimeUnit.SECONDS.toNanos(seconds) < nanos ? seconds + 1 : seconds;
    }
}
