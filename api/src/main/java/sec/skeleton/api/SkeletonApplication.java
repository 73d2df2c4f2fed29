package sec.skeleton.api;

import sec.skeleton.api.config.AppConfig;
import sec.skeleton.api.config.EnvironmentConfigValidator;
import sec.skeleton.api.exception.ConfigValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Entry point.
 * Startup order: validate environment, build the context (security chain + routes), listen.
 * Nothing is bound to a socket when validation fails.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class SkeletonApplication {

    private static final Logger logger = LoggerFactory.getLogger(SkeletonApplication.class);

    static final String BIND_ADDRESS = "0.0.0.0";

    public static void main(String[] args) {
        try {
            start(System.getenv(), args);
        } catch (ConfigValidationException ex) {
            System.exit(1);
        }
    }

    /**
     * Validates the environment and, only if it is valid, builds and runs the application.
     *
     * @throws ConfigValidationException after logging every violation; no application is built
     */
    public static ConfigurableApplicationContext start(Map<String, String> env, String... args) {
        return start(env, SkeletonApplication::create, args);
    }

    static ConfigurableApplicationContext start(Map<String, String> env,
                                                Function<AppConfig, SpringApplication> factory,
                                                String... args) {
        AppConfig appConfig;
        try {
            appConfig = new EnvironmentConfigValidator().validate(env);
        } catch (ConfigValidationException ex) {
            ex.getViolations().forEach((variable, reason) ->
                    logger.error("Invalid environment variable {}: {}", variable, reason));
            logger.error("Refusing to start: {}", ex.getMessage());
            throw ex;
        }

        return factory.apply(appConfig).run(args);
    }

    /**
     * Builds the application for an already validated configuration.
     * The configuration is registered as a singleton bean before the context refreshes.
     */
    public static SpringApplication create(AppConfig appConfig) {
        SpringApplication application = new SpringApplication(SkeletonApplication.class);

        Map<String, Object> defaults = new HashMap<>();
        defaults.put("server.port", appConfig.port());
        defaults.put("server.address", BIND_ADDRESS);
        application.setDefaultProperties(defaults);

        application.addInitializers(context ->
                context.getBeanFactory().registerSingleton("appConfig", appConfig));
        return application;
    }
}
