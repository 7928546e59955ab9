package com.example.kodeposimport.scheduler;

import com.example.kodeposimport.config.AppProperties;
import com.example.kodeposimport.entity.ImportJob;
import com.example.kodeposimport.enums.ImportStatus;
import com.example.kodeposimport.repository.ImportJobRepository;
import com.example.kodeposimport.service.JobStateManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 启动时的"清洁工"
 * 作用：本节点上次停机时正在执行的作业不会再有人驱动，直接置为失败
 * 只处理 node_id 为本节点的作业；PENDING 作业还没开始执行，保持不动
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupJobResetter implements ApplicationRunner {

    static final String INTERRUPTED_MESSAGE = "Import interrupted by a service restart";

    private static final Set<ImportStatus> RUNNING = EnumSet.of(
            ImportStatus.PROCESSING, ImportStatus.VALIDATING, ImportStatus.TRANSFORMING, ImportStatus.INSERTING);

    private final ImportJobRepository jobRepo;
    private final JobStateManager stateManager;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        log.info(">>> 系统启动，开始检查异常中断的导入作业...");

        String currentNodeId = appProperties.getCurrentNodeId();
        List<String> interrupted = jobRepo.findByStatusInAndNodeId(RUNNING, currentNodeId).stream()
                .map(ImportJob::getId)
                .collect(Collectors.toList());
        int count = stateManager.failAll(interrupted, RUNNING, INTERRUPTED_MESSAGE);
        if (count > 0) {
            log.warn("检测到本节点 [{}] 有 {} 个导入作业在执行中途崩溃，已置为 FAILED。", currentNodeId, count);
        }

        log.info("<<< 异常作业清理完毕。");
    }
}
