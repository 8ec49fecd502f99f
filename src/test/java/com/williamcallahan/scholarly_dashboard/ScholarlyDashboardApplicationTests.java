package com.williamcallahan.scholarly_dashboard;

import com.williamcallahan.scholarly_dashboard.repository.DatabaseHandler;
import com.williamcallahan.scholarly_dashboard.service.aggregate.GroupBy;
import com.williamcallahan.scholarly_dashboard.service.aggregate.WorksAggregateService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ScholarlyDashboardApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private WorksAggregateService aggregateService;

    @TempDir
    Path tempDir;

    @Test
    void contextLoadsWithoutDatabase() {
        assertThat(context.getBeanNamesForType(DatabaseHandler.class)).isEmpty();
        assertThat(aggregateService.publicationsByYear(null, null, GroupBy.NONE)).isEmpty();
    }

    @Test
    void dotEnvValuesDoNotOverrideExistingProperties() throws Exception {
        Path envFile = tempDir.resolve(".env");
        Files.writeString(envFile, "SCHOLARLY_TEST_NEW=fromfile\nSCHOLARLY_TEST_SET=fromfile\n");
        System.setProperty("SCHOLARLY_TEST_SET", "explicit");
        try {
            ScholarlyDashboardApplication.loadDotEnvFile(envFile);

            assertThat(System.getProperty("SCHOLARLY_TEST_NEW")).isEqualTo("fromfile");
            assertThat(System.getProperty("SCHOLARLY_TEST_SET")).isEqualTo("explicit");
        } finally {
            System.clearProperty("SCHOLARLY_TEST_NEW");
            System.clearProperty("SCHOLARLY_TEST_SET");
        }
    }
}
