package com.example.kodeposimport.service;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobStateManagerTest {

    @Mock private ImportJobRepository jobRepo;
    @Spy private AppProperties config = new AppProperties();

    @InjectMocks
    private JobStateManager stateManager;

    @Test
    @DisplayName("启动作业时记录执行节点")
    void start_recordsCurrentNode() {
        config.setCurrentNodeId("node-a");
        when(jobRepo.start(eq("job-1"), eq(ImportStatus.PENDING), eq(ImportStatus.PROCESSING), eq("node-a"),
                any(LocalDateTime.class))).thenReturn(1);

        assertTrue(stateManager.start("job-1"));
    }

    @Test
    void start_notPending() {
        when(jobRepo.start(any(), any(), any(), any(), any())).thenReturn(0);
        assertFalse(stateManager.start("job-1"));
    }

    @Test
    @DisplayName("非法流转直接抛异常")
    void advance_illegalTransition() {
        assertThrows(IllegalStateException.class,
                () -> stateManager.advance("job-1", ImportStatus.PROCESSING, ImportStatus.INSERTING));
        verifyNoInteractions(jobRepo);
    }
}
