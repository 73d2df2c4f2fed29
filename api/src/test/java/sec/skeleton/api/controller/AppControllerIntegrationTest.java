package sec.skeleton.api.controller;

import sec.skeleton.support.TestAppConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full request pipeline: security headers, rate limiter, controller, service.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestAppConfig.class)
@ActiveProfiles("test")
class AppControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testGetRoot_ReturnsGreeting() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Hello World!"));
    }

    @Test
    void testGetRoot_IgnoresQueryAndHeaders() throws Exception {
        mockMvc.perform(get("/")
                        .param("name", "someone")
                        .param("lang", "fr")
                        .header("X-Custom", "value")
                        .accept(MediaType.APPLICATION_JSON))
                .andExpect(status().isOk())
                .andExpect(content().string("Hello World!"));
    }

    @Test
    void testGetHealth_ReturnsStatusOk() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().json("{\"status\":\"ok\"}", true));
    }

    @Test
    void testGetHealth_IgnoresAcceptHeader() throws Exception {
        mockMvc.perform(get("/health").accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void testHardeningHeaders_Present() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Content-Type-Options", "nosniff"))
                .andExpect(header().string("X-Frame-Options", "SAMEORIGIN"))
                .andExpect(header().string("Strict-Transport-Security", "max-age=31536000 ; includeSubDomains"))
                .andExpect(header().string("Referrer-Policy", "no-referrer"))
                .andExpect(header().string("X-XSS-Protection", "0"))
                .andExpect(header().string("Cross-Origin-Opener-Policy", "same-origin"))
                .andExpect(header().string("Cross-Origin-Resource-Policy", "same-origin"))
                .andExpect(header().string("Origin-Agent-Cluster", "?1"))
                .andExpect(header().string("X-DNS-Prefetch-Control", "off"))
                .andExpect(header().string("X-Download-Options", "noopen"))
                .andExpect(header().string("X-Permitted-Cross-Domain-Policies", "none"));
    }

    @Test
    void testContentSecurityPolicy_NotSent() throws Exception {
        MvcResult result = mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andReturn();

        assertNull(result.getResponse().getHeader("Content-Security-Policy"));
        assertNull(result.getResponse().getHeader("Cache-Control"));
    }

    @Test
    void testRateLimitHeaders_OnAllowedResponse() throws Exception {
        mockMvc.perform(get("/health").with(request -> {
                    request.setRemoteAddr("192.0.2.10");
                    return request;
                }))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Limit", "100"))
                .andExpect(header().string("X-RateLimit-Remaining", "99"))
                .andExpect(header().exists("X-RateLimit-Reset"));
    }

    @Test
    void testUnknownRoute_NotFound() throws Exception {
        mockMvc.perform(get("/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Route GET:/missing not found"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"));
    }

    @Test
    void testWrongMethod_NotAllowed() throws Exception {
        mockMvc.perform(post("/health"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.message").value("Method POST not allowed"));
    }
}
