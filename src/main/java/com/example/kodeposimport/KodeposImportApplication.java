package com.example.kodeposimport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 维护任务 (僵尸作业 / 过期数据清理) 依赖它
public class KodeposImportApplication {

    public static void main(String[] args) {
        SpringApplication.run(KodeposImportApplication.class, args);
    }
}
