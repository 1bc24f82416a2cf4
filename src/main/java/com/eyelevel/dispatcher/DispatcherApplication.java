package com.eyelevel.dispatcher;

import com.eyelevel.dispatcher.config.DispatchConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Analysis Dispatcher Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.dispatch" properties to {@link DispatchConfig}.</li>
 *     <li>{@link EnableScheduling}: Activates the periodic expiry sweep.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for the document store repositories.</li>
 *     <li>{@link EnableRetry}: Enables retries around object store calls.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.dispatcher.repository")
@EnableConfigurationProperties(value = DispatchConfig.class)
@EnableRetry
public class DispatcherApplication {

    public static void main(final String[] args) {
        log.info("Starting DispatcherApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DispatcherApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "AnalysisDispatcher"));
        log.info("  - Stages:     {}", env.getProperty("app.dispatch.stages", "pre,core,post"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
