package com.tripmatch.server.training;

import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.properties.TrainingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时训练，默认每天 03:00；多实例部署时由训练锁保证只有一个实例真正执行。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingScheduleTask {

    private final TrainingPipeline trainingPipeline;
    private final TrainingProperties trainingProperties;

    @Scheduled(cron = "${tripmatch.training.cron:0 0 3 * * ?}")
    public void scheduledRun() {
        if (!trainingProperties.isEnabled()) {
            log.debug("定时训练已关闭，跳过");
            return;
        }
        try {
            trainingPipeline.run("schedule");
        } catch (BaseException e) {
            log.info("定时训练未执行: {}", e.getMessage());
        }
    }
}
