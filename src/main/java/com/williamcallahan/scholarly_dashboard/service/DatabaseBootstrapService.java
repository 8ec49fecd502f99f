package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.config.DatabaseProperties;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.util.DatabaseUrlUtils;
import com.williamcallahan.scholarly_dashboard.util.JdbcUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.stereotype.Service;

import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * Prepares the target database at startup
 *
 * @author William Callahan
 *
 * Features:
 * - Optionally creates the target database through an admin connection when it is missing
 * - Creates the schema tables that do not exist yet
 * - Runs as the first ApplicationRunner, before any startup harvest
 */
@Service
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class DatabaseBootstrapService implements ApplicationRunner {

    private final DatabaseHandler databaseHandler;
    private final DatabaseProperties properties;
    private final String datasourceUrl;
    private final String username;
    private final String password;
    private final Function<String, JdbcTemplate> adminTemplateFactory;

    @Autowired
    public DatabaseBootstrapService(DatabaseHandler databaseHandler,
                                    DatabaseProperties properties,
                                    @Value("${spring.datasource.url}") String datasourceUrl,
                                    @Value("${spring.datasource.username:}") String username,
                                    @Value("${spring.datasource.password:}") String password) {
        this.databaseHandler = databaseHandler;
        this.properties = properties;
        this.datasourceUrl = datasourceUrl;
        this.username = username;
        this.password = password;
        this.adminTemplateFactory = this::adminTemplate;
    }

    DatabaseBootstrapService(DatabaseHandler databaseHandler,
                             DatabaseProperties properties,
                             String datasourceUrl,
                             Function<String, JdbcTemplate> adminTemplateFactory) {
        this.databaseHandler = databaseHandler;
        this.properties = properties;
        this.datasourceUrl = datasourceUrl;
        this.username = null;
        this.password = null;
        this.adminTemplateFactory = adminTemplateFactory;
    }

    @Override
    public void run(ApplicationArguments args) {
        bootstrap();
    }

    public void bootstrap() {
        if (properties.isCreateIfMissing()) {
            createDatabaseIfMissing();
        }
        if (properties.isEnsureSchemaOnStartup()) {
            databaseHandler.ensureSchema();
        }
    }

    /**
     * Creates the database named in the datasource URL when the admin connection does not list it.
     *
     * @return true when the database was created by this call
     */
    boolean createDatabaseIfMissing() {
        String databaseName = DatabaseUrlUtils.databaseName(datasourceUrl);
        if (!DatabaseUrlUtils.isSafeDatabaseName(databaseName)) {
            throw new IllegalStateException("Refusing to create database with name '" + databaseName + "'");
        }
        String adminUrl = properties.getAdminUrl();
        if (adminUrl == null || adminUrl.isBlank()) {
            adminUrl = DatabaseUrlUtils.replaceDatabaseName(datasourceUrl, "postgres");
        }

        JdbcTemplate admin = adminTemplateFactory.apply(adminUrl);
        if (JdbcUtils.exists(admin, "SELECT 1 FROM pg_database WHERE datname = ?", databaseName)) {
            log.info("Database '{}' already exists", databaseName);
            return false;
        }
        // Quoted so the stored name keeps its case and matches the datname lookup above.
        admin.execute("CREATE DATABASE \"" + databaseName + "\"");
        log.info("Created database '{}'", databaseName);
        return true;
    }

    private JdbcTemplate adminTemplate(String adminUrl) {
        try {
            Driver driver = DriverManager.getDriver(adminUrl);
            return new JdbcTemplate(new SimpleDriverDataSource(driver, adminUrl, username, password));
        } catch (SQLException e) {
            throw new IllegalStateException("No JDBC driver for admin URL " + adminUrl, e);
        }
    }
}
