package sec.skeleton.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import sec.skeleton.api.filter.RateLimitingFilter;
import sec.skeleton.api.service.ratelimit.ClientRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate limiting configuration.
 * Values come from application.properties (rate-limit.*).
 */
@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    @Value("${rate-limit.max:100}")
    private long maxRequests;

    @Value("${rate-limit.time-window:1m}")
    private Duration timeWindow;

    @Value("${rate-limit.cache-size:5000}")
    private long cacheSize;

    @Bean
    public ClientRateLimiter clientRateLimiter() {
        logger.info("Rate limiting: enabled={}, max={} requests per {}, tracking up to {} clients",
                enabled, maxRequests, timeWindow, cacheSize);
        return new ClientRateLimiter(maxRequests, timeWindow, cacheSize);
    }

    @Bean
    public RateLimitingFilter rateLimitingFilter(ClientRateLimiter clientRateLimiter, ObjectMapper objectMapper) {
        return new RateLimitingFilter(clientRateLimiter, objectMapper, enabled);
    }

    /**
     * The filter runs inside the Spring Security chain only; keep the servlet
     * container from registering it a second time.
     */
    @Bean
    public FilterRegistrationBean<RateLimitingFilter> rateLimitingFilterRegistration(RateLimitingFilter filter) {
        FilterRegistrationBean<RateLimitingFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
