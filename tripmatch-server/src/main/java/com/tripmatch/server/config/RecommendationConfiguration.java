package com.tripmatch.server.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tripmatch.common.properties.RecommendationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 排序链路的基础设施 Bean：时钟、缓存计时器与打分线程池。
 * 测试中直接构造组件并传入固定时钟 / 假计时器，不依赖 Spring 容器。
 */
@Configuration
@Slf4j
public class RecommendationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    /**
     * 固定大小的打分线程池，只用于大候选集的分片打分。
     */
    @Bean(name = "scoringExecutor", destroyMethod = "shutdown")
    public ExecutorService scoringExecutor(RecommendationProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        log.info("创建打分线程池: threads={}, parallelThreshold={}", threads, properties.getParallelThreshold());
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("rank-worker-"));
    }
}
