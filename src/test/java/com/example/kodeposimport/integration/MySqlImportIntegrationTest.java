package com.example.kodeposimport.integration;

import com.example.kodeposimport.dto.ImportConfigurationRequest;
import com.example.kodeposimport.dto.ImportResultSummary;
import com.example.kodeposimport.entity.ImportValidationResult;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.service.ImportJobManager;
import com.example.kodeposimport.service.ImportService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 真实 MySQL 8 上跑一遍: 唯一约束、CHECK 约束、保留字列名
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class MySqlImportIntegrationTest {

    @Container
    static final MySQLContainer<?> MYSQL_CONTAINER = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("kodepos")
            .withUsername("test")
            .withPassword("testpasswd");

    @DynamicPropertySource
    static void registerMySQLProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", MYSQL_CONTAINER::getJdbcUrl);
        registry.add("spring.datasource.username", MYSQL_CONTAINER::getUsername);
        registry.add("spring.datasource.password", MYSQL_CONTAINER::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired private ImportService importService;
    @Autowired private ImportJobManager jobManager;
    @Autowired private JdbcTemplate jdbcTemplate;

    private static byte[] csv(String... rows) {
        return ("kodepos,province,city,district,village,latitude,longitude,elevation,timezone\n"
                + String.join("\n", rows)).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("MySQL: 导入 -> 重复冲突 -> 覆盖")
    void importLifecycle() {
        jdbcTemplate.update("DELETE FROM postal_codes");

        ImportResultSummary first = importService.submit("kodepos.csv", ImportContentType.CSV.getMimeType(), csv(
                "10110,DKI Jakarta,Jakarta Pusat,Menteng,Menteng,-6.1944,106.8229,10,WIB",
                "80361,Bali,Badung,Kuta,Kuta,-8.7184,115.1686,5,WITA"), null, "it");
        assertEquals(ImportStatus.COMPLETED, first.getStatus());
        assertEquals(2, first.getSuccessfulRecords());

        ImportConfigurationRequest error = new ImportConfigurationRequest();
        error.setDuplicateStrategy("error");
        ImportResultSummary conflict = importService.submit("kodepos.csv", ImportContentType.CSV.getMimeType(), csv(
                "10110,DKI Jakarta,Jakarta Pusat,Menteng,Menteng,-6.1944,106.8229,10,WIB"), error, "it");
        assertEquals(1, conflict.getFailedRecords());
        List<ImportValidationResult> results = jobManager.validationResults(conflict.getJobId(), null);
        assertEquals(1, results.size());
        assertEquals(1L, results.get(0).getRowNumber());

        ImportConfigurationRequest update = new ImportConfigurationRequest();
        update.setDuplicateStrategy("update");
        ImportResultSummary updated = importService.submit("kodepos.csv", ImportContentType.CSV.getMimeType(), csv(
                "80361,Bali,Badung,Kuta,Kuta Selatan,-8.7184,115.1686,,WITA"), update, "it");
        assertEquals(1, updated.getSuccessfulRecords());

        assertEquals(2L, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM postal_codes", Long.class));
        assertEquals("Kuta Selatan",
                jdbcTemplate.queryForObject("SELECT village FROM postal_codes WHERE code = 80361", String.class));
        assertNull(jdbcTemplate.queryForObject("SELECT elevation FROM postal_codes WHERE code = 80361", Integer.class));
    }
}
