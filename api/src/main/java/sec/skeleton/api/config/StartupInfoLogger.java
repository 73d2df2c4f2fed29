package sec.skeleton.api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the effective configuration once the server is accepting requests.
 * Secret values are reported only as present or absent.
 */
@Component
public class StartupInfoLogger {

    private static final Logger logger = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final AppConfig appConfig;

    public StartupInfoLogger(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        logger.info("Service ready: environment={}, port={}, apiKey={}, databaseUrl={}",
                appConfig.environment().value(),
                appConfig.port(),
                appConfig.hasApiKey() ? "configured" : "not configured",
                appConfig.hasDatabaseUrl() ? "configured" : "not configured");
    }
}
