package com.tripmatch.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer 指标；
 * - 指标记录失败只打 debug 日志，不影响排序与训练主流程；
 * - 指标命名参考「组件.业务.动作」，便于在监控面板上按模块聚合展示。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录缓存访问结果。
     *
     * @param cache   preferences / score
     * @param outcome hit / miss / error
     */
    public void recordCacheAccess(String cache, String outcome) {
        try {
            meterRegistry.counter("tripmatch.cache.access", "cache", safe(cache), "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录缓存指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次 Top-K 选择的耗时与规模。
     */
    public void recordRankLatencyMs(long latencyMs, int candidateCount, boolean parallel) {
        try {
            meterRegistry.timer("tripmatch.rank.latency", "mode", parallel ? "parallel" : "sequential")
                    .record(latencyMs, TimeUnit.MILLISECONDS);
            meterRegistry.summary("tripmatch.rank.candidates").record(candidateCount);
        } catch (Exception e) {
            log.debug("记录排序耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录被上界预过滤跳过的候选数量。
     */
    public void recordPrefilterSkipped(int skipped) {
        if (skipped <= 0) {
            return;
        }
        try {
            meterRegistry.counter("tripmatch.rank.prefilter.skipped").increment(skipped);
        } catch (Exception e) {
            log.debug("记录预过滤指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录训练任务结果。
     *
     * @param outcome deployed / discarded / rejected
     * @param reason  丢弃原因，部署成功时为 ok
     */
    public void recordTrainingRun(String outcome, String reason) {
        try {
            meterRegistry.counter("tripmatch.training.run", "outcome", safe(outcome), "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录训练指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录权重切换（发布 / 回滚）。
     */
    public void recordWeightActivation(String reason) {
        try {
            meterRegistry.counter("tripmatch.weights.activation", "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录权重切换指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
