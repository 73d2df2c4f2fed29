package sec.skeleton.api.service.general;

import sec.skeleton.api.model.response.HealthStatus;
import org.springframework.stereotype.Service;

/**
 * GreetingService
 * Serves the root greeting and the liveness/readiness status.
 * No I/O and no configuration access; both values are fixed.
 */
@Service
public class GreetingService {

    public static final String GREETING = "Hello World!";

    public String getHello() {
        return GREETING;
    }

    /**
     * Always "ok" while the process is able to serve requests.
     */
    public HealthStatus getHealth() {
        return HealthStatus.ok();
    }
}
