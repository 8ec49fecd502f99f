/**
 * Main application class for the scholarly works dashboard
 *
 * @author William Callahan
 *
 * Features:
 * - Harvests an institution's works from OpenAlex into PostgreSQL and/or a JSON lines file
 * - Serves read-only aggregates for the dashboard
 * - Starts without a database when spring.datasource.url is unset
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.scholarly_dashboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@SpringBootApplication(exclude = {
    // Schema is created by the database handler, not by schema.sql
    SqlInitializationAutoConfiguration.class
})
public class ScholarlyDashboardApplication {

    private static final Logger log = LoggerFactory.getLogger(ScholarlyDashboardApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        // Load .env file first
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(ScholarlyDashboardApplication.class, args);
    }

    /**
     * Copies entries of a .env file into system properties unless the environment already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(envFile)) {
            props.load(is);
        } catch (IOException | SecurityException e) {
            log.warn("Could not read {}: {}", envFile, e.getMessage());
            return;
        }
        for (String key : props.stringPropertyNames()) {
            if (System.getenv(key) == null && System.getProperty(key) == null) {
                System.setProperty(key, props.getProperty(key));
            }
        }
    }
}
