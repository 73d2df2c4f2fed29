package sec.skeleton.api.service.general;

import sec.skeleton.api.model.response.HealthStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GreetingServiceTest {

    private final GreetingService greetingService = new GreetingService();

    @Test
    void testGetHello() {
        assertEquals("Hello World!", greetingService.getHello());
    }

    @Test
    void testGetHealth() {
        HealthStatus health = greetingService.getHealth();
        assertEquals(new HealthStatus("ok"), health);
    }

    @Test
    void testResultsAreStable() {
        assertEquals(greetingService.getHello(), greetingService.getHello());
        assertEquals(greetingService.getHealth(), greetingService.getHealth());
    }
}
