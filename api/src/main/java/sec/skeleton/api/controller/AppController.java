package sec.skeleton.api.controller;

import sec.skeleton.api.model.response.HealthStatus;
import sec.skeleton.api.service.general.GreetingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * AppController
 * Root endpoints: greeting and health probe.
 * Every route is behind the rate limiter and the security headers configured in SecurityConfig.
 */
@RestController
public class AppController {

    private static final Logger logger = LoggerFactory.getLogger(AppController.class);

    private final GreetingService greetingService;

    public AppController(GreetingService greetingService) {
        this.greetingService = greetingService;
    }

    /**
     * Greeting as plain text.
     * GET /
     */
    @GetMapping("/")
    public ResponseEntity<String> getHello() {
        logger.debug("Root endpoint accessed");
        // Content type is fixed so the Accept header cannot change the response
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(greetingService.getHello());
    }

    /**
     * Liveness / readiness probe used by orchestrators and load balancers.
     * GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthStatus> getHealth() {
        logger.debug("Health endpoint accessed");
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(greetingService.getHealth());
    }
}
