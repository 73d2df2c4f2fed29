package sec.skeleton.api.filter;

import sec.skeleton.support.TestAppConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Runs with a quota of 3 requests per minute. Each test uses its own client address
 * because buckets are shared across the context.
 */
@SpringBootTest(properties = {
        "rate-limit.max=3",
        "rate-limit.time-window=1m"
})
@AutoConfigureMockMvc
@Import(TestAppConfig.class)
@ActiveProfiles("test")
@DirtiesContext
class RateLimitingFilterIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testExcessRequests_Rejected() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(fromClient(get("/"), "198.51.100.1"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-RateLimit-Remaining", String.valueOf(2 - i)));
        }

        mockMvc.perform(fromClient(get("/"), "198.51.100.1"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(header().string("X-RateLimit-Limit", "3"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.statusCode").value(429))
                .andExpect(jsonPath("$.error").value("Too Many Requests"))
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void testQuotaShared_AcrossRoutes() throws Exception {
        mockMvc.perform(fromClient(get("/"), "198.51.100.2")).andExpect(status().isOk());
        mockMvc.perform(fromClient(get("/health"), "198.51.100.2")).andExpect(status().isOk());
        mockMvc.perform(fromClient(get("/missing"), "198.51.100.2")).andExpect(status().isNotFound());

        mockMvc.perform(fromClient(get("/health"), "198.51.100.2"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void testOtherClient_NotAffected() throws Exception {
        for (int i = 0; i < 4; i++) {
            mockMvc.perform(fromClient(get("/"), "198.51.100.3"));
        }

        mockMvc.perform(fromClient(get("/"), "198.51.100.4"))
                .andExpect(status().isOk())
                .andExpect(content().string("Hello World!"));
    }

    @Test
    void testForwardedHeader_NotTrusted() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(fromClient(get("/"), "198.51.100.5")
                    .header("X-Forwarded-For", "203.0.113." + i));
        }

        mockMvc.perform(fromClient(get("/"), "198.51.100.5")
                        .header("X-Forwarded-For", "203.0.113.99"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void testRejectedResponse_KeepsHardeningHeaders() throws Exception {
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(fromClient(get("/health"), "198.51.100.6"));
        }

        mockMvc.perform(fromClient(get("/health"), "198.51.100.6"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andExpect(header().string("X-Frame-Options", "SAMEORIGIN"))
                .andExpect(header().doesNotExist("Content-Security-Policy"));
    }

    private static MockHttpServletRequestBuilder fromClient(MockHttpServletRequestBuilder builder, String address) {
        return builder.with(request -> {
            request.setRemoteAddr(address);
            return request;
        });
    }
}
