package com.handelsregister.scraper.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads a `.env` file from the working directory so that
 * `JWT_SECRET_KEY`, `RATE_LIMIT_DEFAULT` and `REQUEST_TIMEOUT` can be kept
 * out of the shell environment. Real environment variables still win.
 */
public class DotenvEnvironmentPostProcessor
        implements EnvironmentPostProcessor, Ordered {

    static final String PROPERTY_SOURCE = "dotenvProperties";

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }

    @Override
    public void postProcessEnvironment(final ConfigurableEnvironment env,
                                       final SpringApplication application) {
        Dotenv dotenv = Dotenv.configure()
                .filename(".env")
                .ignoreIfMissing()
                .ignoreIfMalformed()
                .load();

        Map<String, Object> map = new HashMap<>();
        dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)
                .forEach(e -> map.put(e.getKey(), e.getValue()));
        if (map.isEmpty()) {
            return;
        }

        // behind system environment, ahead of application.yml
        String systemEnv = "systemEnvironment";
        if (env.getPropertySources().contains(systemEnv)) {
            env.getPropertySources().addAfter(systemEnv, new MapPropertySource(PROPERTY_SOURCE, map));
        } else {
            env.getPropertySources().addLast(new MapPropertySource(PROPERTY_SOURCE, map));
        }
    }
}
