package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.dto.HistoryFilter;
import com.example.kodeposimport.dto.HistoryPage;
import com.example.kodeposimport.dto.ImportConfigurationRequest;
import com.example.kodeposimport.dto.JobStatusView;
import com.example.kodeposimport.entity.ImportConfiguration;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.DuplicateStrategy;
import com.example.kodeposimport.enums.ImportContentType;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.exception.ImportErrorCode;
import com.example.kodeposimport.exception.ImportException;
import com.example.kodeposimport.exception.JobNotFoundException;
import com.example.kodeposimport.repository.ImportConfigurationRepository;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.repository.ImportValidationResultRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ImportJobManagerTest {

    @Mock private ImportJobRepository jobRepo;
    @Mock private ImportConfigurationRepository configRepo;
    @Mock private ImportValidationResultRepository validationResultRepo;
    @Mock private JobStateManager stateManager;
    @Spy private AppProperties config = new AppProperties();

    @InjectMocks
    private ImportJobManager jobManager;

    private ImportJob job(String id, ImportStatus status) {
        ImportJob job = new ImportJob();
        job.setId(id);
        job.setStatus(status);
        job.setFilename("kodepos.json");
        job.setFileSize(100L);
        job.setContentType(ImportContentType.JSON);
        return job;
    }

    @Test
    @DisplayName("未指定的配置项使用默认值")
    void buildConfiguration_defaults() {
        ImportConfiguration configuration = jobManager.buildConfiguration(null);

        assertEquals(DuplicateStrategy.SKIP, configuration.getDuplicateStrategy());
        assertEquals(1000, configuration.getBatchSize());
        assertTrue(configuration.isValidateCoordinates());
        assertTrue(configuration.isSkipInvalidRecords());
        assertNull(configuration.getNotificationEmail());
    }

    @Test
    void buildConfiguration_customValues() {
        ImportConfigurationRequest request = new ImportConfigurationRequest();
        request.setDuplicateStrategy("Update");
        request.setBatchSize(10_000);
        request.setValidateCoordinates(false);
        request.setSkipInvalidRecords(false);
        request.setNotificationEmail("ops@example.co.id");
        request.setCustomValidationRules(Map.of("strict_names", true));

        ImportConfiguration configuration = jobManager.buildConfiguration(request);

        assertEquals(DuplicateStrategy.UPDATE, configuration.getDuplicateStrategy());
        assertEquals(10_000, configuration.getBatchSize());
        assertFalse(configuration.isValidateCoordinates());
        assertFalse(configuration.isSkipInvalidRecords());
        assertEquals("ops@example.co.id", configuration.getNotificationEmail());
        assertEquals("{\"strict_names\":true}", configuration.getCustomValidationRules());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 10_001})
    @DisplayName("批次大小超出范围")
    void buildConfiguration_batchSizeOutOfRange(int batchSize) {
        ImportConfigurationRequest request = new ImportConfigurationRequest();
        request.setBatchSize(batchSize);

        ImportException e = assertThrows(ImportException.class, () -> jobManager.buildConfiguration(request));
        assertEquals(ImportErrorCode.INVALID_CONFIGURATION, e.getCode());
    }

    @Test
    void buildConfiguration_unknownStrategy() {
        ImportConfigurationRequest request = new ImportConfigurationRequest();
        request.setDuplicateStrategy("merge");

        ImportException e = assertThrows(ImportException.class, () -> jobManager.buildConfiguration(request));
        assertEquals(ImportErrorCode.INVALID_CONFIGURATION, e.getCode());
    }

    @Test
    void buildConfiguration_invalidEmail() {
        ImportConfigurationRequest request = new ImportConfigurationRequest();
        request.setNotificationEmail("not-an-email");

        ImportException e = assertThrows(ImportException.class, () -> jobManager.buildConfiguration(request));
        assertEquals(ImportErrorCode.INVALID_CONFIGURATION, e.getCode());
    }

    @Test
    @DisplayName("创建作业: PENDING + 配置关联作业 id")
    void create_persistsJobAndConfiguration() {
        when(jobRepo.save(any(ImportJob.class))).thenAnswer(inv -> {
            ImportJob saved = inv.getArgument(0);
            saved.setId("job-1");
            return saved;
        });

        ImportJob created = jobManager.create("kodepos.csv", 512, ImportContentType.CSV, null, " alice ");

        assertEquals("job-1", created.getId());
        assertEquals(ImportStatus.PENDING, created.getStatus());
        assertEquals("alice", created.getCreatedBy());
        ArgumentCaptor<ImportConfiguration> captor = ArgumentCaptor.forClass(ImportConfiguration.class);
        verify(configRepo).save(captor.capture());
        assertEquals("job-1", captor.getValue().getJobId());
    }

    @Test
    @DisplayName("创建作业时配置非法不落库")
    void create_invalidConfigurationPersistsNothing() {
        ImportConfigurationRequest request = new ImportConfigurationRequest();
        request.setBatchSize(0);

        assertThrows(ImportException.class,
                () -> jobManager.create("kodepos.csv", 512, ImportContentType.CSV, request, null));
        verifyNoInteractions(jobRepo, configRepo);
    }

    @Test
    @DisplayName("进度百分比和剩余时间估算")
    void status_progressAndEstimate() {
        ImportJob job = job("job-1", ImportStatus.INSERTING);
        job.setTotalRecords(200);
        job.setProcessedRecords(50);
        job.setStartedAt(LocalDateTime.now().minusSeconds(10));
        when(jobRepo.findById("job-1")).thenReturn(Optional.of(job));
        when(configRepo.findByJobId("job-1")).thenReturn(Optional.empty());

        JobStatusView view = jobManager.status("job-1");

        assertEquals(25.0, view.getProgressPercentage(), 0.0001);
        assertNotNull(view.getEstimatedRemainingTimeMs());
        // elapsed ~10s, 剩余 150 条 -> ~30s
        assertTrue(view.getEstimatedRemainingTimeMs() >= 29_000 && view.getEstimatedRemainingTimeMs() <= 33_000,
                "estimate was " + view.getEstimatedRemainingTimeMs());
    }

    @Test
    @DisplayName("还没处理任何记录时无法估算")
    void status_unknownEstimate() {
        ImportJob job = job("job-1", ImportStatus.PENDING);
        when(jobRepo.findById("job-1")).thenReturn(Optional.of(job));
        when(configRepo.findByJobId("job-1")).thenReturn(Optional.empty());

        JobStatusView view = jobManager.status("job-1");

        assertEquals(0.0, view.getProgressPercentage());
        assertNull(view.getEstimatedRemainingTimeMs());
    }

    @Test
    void status_unknownJob() {
        when(jobRepo.findById("missing")).thenReturn(Optional.empty());
        ImportException e = assertThrows(JobNotFoundException.class, () -> jobManager.status("missing"));
        assertEquals(ImportErrorCode.JOB_NOT_FOUND, e.getCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"COMPLETED", "FAILED", "CANCELLED"})
    @DisplayName("终态作业取消返回 false")
    void cancel_terminalJob(String status) {
        when(jobRepo.findById("job-1")).thenReturn(Optional.of(job("job-1", ImportStatus.valueOf(status))));

        assertFalse(jobManager.cancel("job-1"));
        verifyNoInteractions(stateManager);
    }

    @Test
    void cancel_runningJob() {
        when(jobRepo.findById("job-1")).thenReturn(Optional.of(job("job-1", ImportStatus.INSERTING)));
        when(stateManager.cancel("job-1")).thenReturn(true);

        assertTrue(jobManager.cancel("job-1"));
    }

    @Test
    @DisplayName("历史查询: 默认按创建时间倒序, 每页大小有上限")
    @SuppressWarnings("unchecked")
    void history_defaultsAndClamp() {
        when(jobRepo.findAll(any(Specification.class), any(Pageable.class))).thenReturn(new PageImpl<>(List.of()));

        HistoryFilter filter = new HistoryFilter();
        filter.setPageSize(500);
        HistoryPage page = jobManager.history(filter);

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);
        verify(jobRepo).findAll(any(Specification.class), captor.capture());
        Pageable pageable = captor.getValue();
        assertEquals(0, pageable.getPageNumber());
        assertEquals(100, pageable.getPageSize());
        assertEquals(Sort.Direction.DESC, pageable.getSort().getOrderFor("createdAt").getDirection());
        assertEquals(1, page.getPage());
        assertEquals(100, page.getPageSize());
    }

    @Test
    void history_invalidSortField() {
        HistoryFilter filter = new HistoryFilter();
        filter.setSortBy("filename");

        ImportException e = assertThrows(ImportException.class, () -> jobManager.history(filter));
        assertEquals(ImportErrorCode.INVALID_REQUEST, e.getCode());
    }
}
