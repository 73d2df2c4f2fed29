package sec.skeleton.api.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import sec.skeleton.api.service.ratelimit.ClientRateLimiter;
import sec.skeleton.api.service.ratelimit.ConsumeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RateLimitingFilter
 * Rejects requests over the per-client quota with 429 before they reach any controller.
 *
 * <p>The client is identified by the socket source address; X-Forwarded-For and similar
 * headers are not trusted. Registered inside the security filter chain (see SecurityConfig),
 * after the header writer, so rejected responses still carry the hardening headers.
 */
public class RateLimitingFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitingFilter.class);

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
    public static final String HEADER_RETRY_AFTER = "Retry-After";

    private final ClientRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;
    private final boolean enabled;

    public RateLimitingFilter(ClientRateLimiter rateLimiter, ObjectMapper objectMapper, boolean enabled) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String clientIp = request.getRemoteAddr();
        ConsumeResult result = rateLimiter.tryConsume(clientIp);

        addRateLimitHeaders(response, result);

        if (!result.allowed()) {
            rejectRequest(request, response, clientIp, result);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void addRateLimitHeaders(HttpServletResponse response, ConsumeResult result) {
        response.setHeader(HEADER_LIMIT, String.valueOf(result.limit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(result.remaining()));
        response.setHeader(HEADER_RESET, String.valueOf(result.resetSeconds()));
    }

    /**
     * Writes the 429 response directly; the request never reaches the dispatcher.
     */
    private void rejectRequest(HttpServletRequest request,
                               HttpServletResponse response,
                               String clientIp,
                               ConsumeResult result) throws IOException {
        long retryAfter = result.retryAfterSeconds();
        logger.warn("Rate limit exceeded: client={}, method={}, uri={}, retryAfter={}s",
                clientIp, request.getMethod(), request.getRequestURI(), retryAfter);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("statusCode", HttpStatus.TOO_MANY_REQUESTS.value());
        body.put("error", HttpStatus.TOO_MANY_REQUESTS.getReasonPhrase());
        body.put("message", "Rate limit exceeded, retry in " + retryAfter + " seconds");

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HEADER_RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
    }
}
