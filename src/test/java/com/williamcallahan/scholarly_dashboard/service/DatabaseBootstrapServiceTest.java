package com.williamcallahan.scholarly_dashboard.service;

import com.williamcallahan.scholarly_dashboard.config.DatabaseProperties;
import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseBootstrapServiceTest {

    private static final String DATASOURCE_URL = "jdbc:postgresql://db.local:5432/openalex?sslmode=require";

    @Mock
    private DatabaseHandler databaseHandler;

    @Mock
    private JdbcTemplate adminTemplate;

    private DatabaseProperties properties;
    private final List<String> adminUrls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new DatabaseProperties();
    }

    @Test
    void bootstrap_ensuresSchemaByDefault() {
        service(DATASOURCE_URL).bootstrap();

        verify(databaseHandler).ensureSchema();
        assertThat(adminUrls).isEmpty();
    }

    @Test
    void bootstrap_canSkipSchemaCreation() {
        properties.setEnsureSchemaOnStartup(false);

        service(DATASOURCE_URL).bootstrap();

        verifyNoInteractions(databaseHandler);
    }

    @Test
    void createDatabaseIfMissing_createsAbsentDatabaseThroughMaintenanceDb() {
        when(adminTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(0L);

        boolean created = service(DATASOURCE_URL).createDatabaseIfMissing();

        assertThat(created).isTrue();
        assertThat(adminUrls).containsExactly("jdbc:postgresql://db.local:5432/postgres?sslmode=require");
        verify(adminTemplate).execute("CREATE DATABASE \"openalex\"");
    }

    @Test
    void createDatabaseIfMissing_leavesExistingDatabaseAlone() {
        properties.setAdminUrl("jdbc:postgresql://admin.local:5432/template1");
        when(adminTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(1L);

        boolean created = service(DATASOURCE_URL).createDatabaseIfMissing();

        assertThat(created).isFalse();
        assertThat(adminUrls).containsExactly("jdbc:postgresql://admin.local:5432/template1");
        verify(adminTemplate, never()).execute(anyString());
    }

    @Test
    void createDatabaseIfMissing_keepsMixedCaseNameMatchingTheLookup() {
        when(adminTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(0L);

        boolean created = service("jdbc:postgresql://db.local:5432/OpenAlex").createDatabaseIfMissing();

        assertThat(created).isTrue();
        verify(adminTemplate).execute("CREATE DATABASE \"OpenAlex\"");
    }

    @Test
    void createDatabaseIfMissing_refusesUnsafeNames() {
        DatabaseBootstrapService service = service("jdbc:postgresql://db.local:5432/bad-name;drop");

        assertThatThrownBy(service::createDatabaseIfMissing).isInstanceOf(IllegalStateException.class);
        assertThat(adminUrls).isEmpty();
    }

    private DatabaseBootstrapService service(String datasourceUrl) {
        return new DatabaseBootstrapService(databaseHandler, properties, datasourceUrl, url -> {
            adminUrls.add(url);
            return adminTemplate;
        });
    }
}
