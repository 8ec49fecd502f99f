package com.williamcallahan.scholarly_dashboard.config;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration to disable database components in absence of a database URL
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when no database URL is configured in properties
 * - Disables Spring's DataSource, transaction manager and JdbcTemplate auto-configuration
 * - Leaves harvesting usable with a JSON lines sink only
 * - Aggregate endpoints answer with empty results
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class
})
public class NoDatabaseConfig {
    // Empty configuration class - functionality provided by annotations
}
