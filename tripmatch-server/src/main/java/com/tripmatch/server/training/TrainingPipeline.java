package com.tripmatch.server.training;

import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.exception.DivergenceException;
import com.tripmatch.common.exception.InsufficientTrainingDataException;
import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.common.properties.TrainingProperties;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.pojo.entity.RecommendationImpression;
import com.tripmatch.pojo.model.TrainingExample;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.pojo.vo.TrainingRunVO;
import com.tripmatch.server.metrics.MetricsRecorder;
import com.tripmatch.server.weights.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 离线权重训练任务。
 *
 * <p>流程：COLLECTING（拉取窗口样本、过滤、划分）-> TRAINING（从线上权重热启动，全量 batch 迭代）
 * -> VALIDATING（同一验证集上对比候选与线上权重）-> DEPLOYING（发布新版本）或 DISCARDING（记录原因）。</p>
 *
 * <p>训练过程中的所有错误都在本类内转换为丢弃结果，不会影响在线排序；线上权重只通过 {@link WeightStore} 切换。
 * 同一时间只允许一个任务运行。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingPipeline {

    static final String OUTCOME_DEPLOYED = "DEPLOYED";
    static final String OUTCOME_DISCARDED = "DISCARDED";

    private final TrainingExampleSource trainingExampleSource;
    private final TrainingDataPreparer trainingDataPreparer;
    private final WeightOptimizer weightOptimizer;
    private final WeightStore weightStore;
    private final TrainingRunLock trainingRunLock;
    private final TrainingProperties trainingProperties;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    private final AtomicReference<TrainingState> state = new AtomicReference<>(TrainingState.IDLE);
    private final AtomicReference<TrainingRunVO> lastReport = new AtomicReference<>();

    /**
     * 执行一次完整训练。
     *
     * @param trigger 触发来源（schedule / admin），只用于日志
     * @throws BaseException TRAINING_ALREADY_RUNNING：已有任务在运行
     */
    public TrainingRunVO run(String trigger) {
        if (!trainingRunLock.tryAcquire()) {
            metricsRecorder.recordTrainingRun("rejected", "already_running");
            throw new BaseException(ErrorCode.TRAINING_ALREADY_RUNNING);
        }
        try {
            TrainingRunVO report = execute(trigger);
            lastReport.set(report);
            return report;
        } finally {
            state.set(TrainingState.IDLE);
            trainingRunLock.release();
        }
    }

    public TrainingState getState() {
        return state.get();
    }

    /**
     * @return 最近一次训练报告，尚未运行过时为 null
     */
    public TrainingRunVO getLastReport() {
        return lastReport.get();
    }

    private TrainingRunVO execute(String trigger) {
        LocalDateTime now = LocalDateTime.now(clock);
        WeightVector base = weightStore.getActive();
        TrainingRunVO report = new TrainingRunVO();
        report.setRunId(UUID.randomUUID().toString().replace("-", ""));
        report.setStartTime(now);
        report.setBaseVersion(base.getVersion());
        log.info("训练任务开始: runId={}, trigger={}, baseVersion={}", report.getRunId(), trigger, base.getVersion());

        // COLLECTING
        state.set(TrainingState.COLLECTING);
        TrainingDataset dataset;
        try {
            List<RecommendationImpression> rows = trainingExampleSource.fetchWindow(
                    now.minusDays(trainingProperties.getWindowDays()), now);
            dataset = trainingDataPreparer.prepare(rows);
            report.setCollected(dataset.getCollected());
            report.setRejected(dataset.getRejected());
            report.setTrainSize(dataset.getTrain().size());
            report.setValidationSize(dataset.getValidation().size());
            checkSufficient(dataset);
        } catch (InsufficientTrainingDataException e) {
            return discard(report, DiscardReason.INSUFFICIENT_TRAINING_DATA, e);
        } catch (RuntimeException e) {
            log.error("拉取训练样本失败: runId={}", report.getRunId(), e);
            return discard(report, DiscardReason.SOURCE_ERROR, e);
        }

        // TRAINING
        state.set(TrainingState.TRAINING);
        WeightVector candidate;
        try {
            candidate = train(base, dataset, report);
        } catch (DivergenceException e) {
            return discard(report, DiscardReason.DIVERGENCE, e);
        } catch (SchemaMismatchException e) {
            return discard(report, DiscardReason.SCHEMA_MISMATCH, e);
        }

        // VALIDATING
        state.set(TrainingState.VALIDATING);
        List<TrainingExample> validation = dataset.getValidation();
        double candidateLoss;
        double activeLoss;
        try {
            candidateLoss = weightOptimizer.loss(candidate, validation);
            activeLoss = weightOptimizer.loss(base, validation);
        } catch (DivergenceException e) {
            return discard(report, DiscardReason.DIVERGENCE, e);
        }
        report.setCandidateValidationLoss(candidateLoss);
        report.setActiveValidationLoss(activeLoss);
        report.setCandidateAuc(finiteOrNull(auc(candidate, validation)));
        report.setActiveAuc(finiteOrNull(auc(base, validation)));
        if (candidateLoss > activeLoss + trainingProperties.getPromotionTolerance()) {
            return discard(report, DiscardReason.VALIDATION_REGRESSION, String.format(
                    "candidate loss %.6f > active loss %.6f + tolerance %.6f",
                    candidateLoss, activeLoss, trainingProperties.getPromotionTolerance()));
        }

        // DEPLOYING
        state.set(TrainingState.DEPLOYING);
        try {
            long version = weightStore.publish(candidate);
            report.setDeployedVersion(version);
        } catch (RuntimeException e) {
            log.error("发布候选权重失败: runId={}", report.getRunId(), e);
            return discard(report, DiscardReason.PUBLISH_FAILED, e);
        }
        report.setOutcome(OUTCOME_DEPLOYED);
        report.setEndTime(LocalDateTime.now(clock));
        metricsRecorder.recordTrainingRun("deployed", "ok");
        log.info("训练任务完成，新权重已上线: runId={}, version={}, candidateLoss={}, activeLoss={}",
                report.getRunId(), report.getDeployedVersion(), candidateLoss, activeLoss);
        return report;
    }

    private void checkSufficient(TrainingDataset dataset) {
        if (dataset.usable() < trainingProperties.getMinExamples()) {
            throw new InsufficientTrainingDataException(String.format(
                    "usable examples %d < minimum %d", dataset.usable(), trainingProperties.getMinExamples()));
        }
        if (dataset.getTrain().isEmpty() || dataset.getValidation().isEmpty()) {
            throw new InsufficientTrainingDataException(String.format(
                    "empty partition: train=%d, validation=%d",
                    dataset.getTrain().size(), dataset.getValidation().size()));
        }
    }

    private WeightVector train(WeightVector base, TrainingDataset dataset, TrainingRunVO report) {
        List<TrainingExample> train = dataset.getTrain();
        List<TrainingExample> validation = dataset.getValidation();
        List<Double> trainLosses = new ArrayList<>(trainingProperties.getEpochs());
        List<Double> validationLosses = new ArrayList<>(trainingProperties.getEpochs());
        report.setTrainLosses(trainLosses);
        report.setValidationLosses(validationLosses);

        // 从线上权重热启动
        WeightVector candidate = WeightVector.draft(base.asMap());
        for (int epoch = 1; epoch <= trainingProperties.getEpochs(); epoch++) {
            GradientResult step = weightOptimizer.computeGradient(candidate, train);
            candidate = weightOptimizer.applyUpdate(candidate, step.getGradient(), trainingProperties.getLearningRate());
            trainLosses.add(weightOptimizer.loss(candidate, train));
            validationLosses.add(weightOptimizer.loss(candidate, validation));
            log.debug("epoch {}: trainLoss={}, validationLoss={}", epoch,
                    trainLosses.get(trainLosses.size() - 1), validationLosses.get(validationLosses.size() - 1));
        }
        return candidate;
    }

    private double auc(WeightVector weights, List<TrainingExample> examples) {
        double[] scores = new double[examples.size()];
        boolean[] positives = new boolean[examples.size()];
        for (int i = 0; i < examples.size(); i++) {
            scores[i] = weightOptimizer.predict(weights, examples.get(i));
            positives[i] = examples.get(i).isClicked();
        }
        return ValidationMetrics.auc(scores, positives);
    }

    private TrainingRunVO discard(TrainingRunVO report, DiscardReason reason, Exception cause) {
        return discard(report, reason, cause.getMessage());
    }

    private TrainingRunVO discard(TrainingRunVO report, DiscardReason reason, String message) {
        state.set(TrainingState.DISCARDING);
        report.setOutcome(OUTCOME_DISCARDED);
        report.setDiscardReason(reason.name());
        report.setMessage(message);
        report.setEndTime(LocalDateTime.now(clock));
        metricsRecorder.recordTrainingRun("discarded", reason.name());
        log.warn("训练任务丢弃候选权重: runId={}, reason={}, message={}, activeVersion={}",
                report.getRunId(), reason, message, report.getBaseVersion());
        return report;
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
