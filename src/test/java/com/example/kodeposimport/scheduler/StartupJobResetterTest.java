package com.example.kodeposimport.scheduler;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.service.JobStateManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StartupJobResetterTest {

    @Mock private ImportJobRepository jobRepo;
    @Mock private JobStateManager stateManager;
    @Spy private AppProperties appProperties = new AppProperties();

    @InjectMocks
    private StartupJobResetter resetter;

    @Test
    @DisplayName("只把本节点执行中的作业置为失败, PENDING 不动")
    @SuppressWarnings("unchecked")
    void run_failsInterruptedJobsOfCurrentNode() {
        appProperties.setCurrentNodeId("node-a");
        ImportJob job = new ImportJob();
        job.setId("job-1");
        job.setStatus(ImportStatus.VALIDATING);
        job.setNodeId("node-a");
        when(jobRepo.findByStatusInAndNodeId(anyCollection(), eq("node-a"))).thenReturn(List.of(job));
        when(stateManager.failAll(anyCollection(), anyCollection(), anyString())).thenReturn(1);

        resetter.run(null);

        ArgumentCaptor<Collection<ImportStatus>> from = ArgumentCaptor.forClass(Collection.class);
        verify(stateManager).failAll(eq(List.of("job-1")), from.capture(), eq(StartupJobResetter.INTERRUPTED_MESSAGE));
        assertFalse(from.getValue().contains(ImportStatus.PENDING));
        assertTrue(from.getValue().contains(ImportStatus.INSERTING));
        verify(jobRepo, never()).findByStatusInAndNodeId(anyCollection(), eq("node-b"));
    }

    @Test
    @DisplayName("其他节点正在执行的作业不受影响")
    void run_leavesJobsOfOtherNodes() {
        appProperties.setCurrentNodeId("node-b");
        when(jobRepo.findByStatusInAndNodeId(anyCollection(), eq("node-b"))).thenReturn(List.of());

        resetter.run(null);

        verify(stateManager).failAll(eq(List.of()), anyCollection(), anyString());
    }
}
