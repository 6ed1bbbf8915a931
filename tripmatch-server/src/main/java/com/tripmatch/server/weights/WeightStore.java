package com.tripmatch.server.weights;

import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.common.properties.WeightProperties;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.metrics.MetricsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 线上权重的唯一事实源。
 *
 * <ul>
 *     <li>读：{@link #getActive()} 只读一个 AtomicReference，不加锁、不阻塞，永远返回完整的不可变快照；</li>
 *     <li>写：发布 / 回滚串行执行，先持久化再切换指针，持久化失败时线上版本保持不变；</li>
 *     <li>历史只追加，版本号严格递增。</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WeightStore {

    static final String SOURCE_DEFAULT = "DEFAULT";
    static final String SOURCE_TRAINING = "TRAINING";
    static final String REASON_BOOTSTRAP = "BOOTSTRAP";
    static final String REASON_PUBLISH = "PUBLISH";
    static final String REASON_ROLLBACK = "ROLLBACK";

    private final WeightRepository weightRepository;
    private final WeightProperties weightProperties;
    private final MetricsRecorder metricsRecorder;
    private final Clock clock;

    private final AtomicReference<WeightVector> active = new AtomicReference<>();
    /** 按版本号升序 */
    private final List<WeightVector> history = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    /**
     * 从持久化历史恢复线上版本；历史为空时发布冷启动权重作为版本 1。
     */
    @PostConstruct
    public void init() {
        synchronized (writeLock) {
            List<WeightVector> loaded = new ArrayList<>(weightRepository.loadAll());
            loaded.sort(Comparator.comparingLong(WeightVector::getVersion));
            history.clear();
            history.addAll(loaded);
            if (history.isEmpty()) {
                long version = doPublish(DefaultWeights.initial(), SOURCE_DEFAULT, REASON_BOOTSTRAP);
                log.info("权重历史为空，已发布冷启动权重: version={}", version);
                return;
            }
            Long activeVersion = weightRepository.loadActiveVersion();
            WeightVector restored = activeVersion == null ? null : find(activeVersion);
            if (restored == null) {
                restored = history.get(history.size() - 1);
                log.warn("激活日志缺失或指向未知版本({})，回退到最新版本: version={}", activeVersion, restored.getVersion());
            }
            active.set(restored);
            log.info("权重恢复完成: activeVersion={}, historySize={}", restored.getVersion(), history.size());
        }
    }

    public WeightVector getActive() {
        WeightVector current = active.get();
        if (current == null) {
            throw new IllegalStateException("weight store is not initialized");
        }
        return current;
    }

    /**
     * 发布训练产出的候选权重为新的线上版本。
     *
     * @param draft 草稿权重（version = 0），key 集合必须与当前特征 Schema 一致
     * @return 新版本号
     */
    public long publish(WeightVector draft) {
        if (!draft.isDraft()) {
            throw new IllegalArgumentException("only draft weights can be published, got version " + draft.getVersion());
        }
        assertPublishable(draft);
        synchronized (writeLock) {
            return doPublish(draft, SOURCE_TRAINING, REASON_PUBLISH);
        }
    }

    /**
     * 将历史版本重新设为线上版本。激活日志追加一条 ROLLBACK 记录，版本历史不变。
     *
     * @return 回滚后的线上权重
     */
    public WeightVector rollback(long version) {
        synchronized (writeLock) {
            WeightVector target = find(version);
            if (target == null) {
                throw new BaseException(ErrorCode.WEIGHT_VERSION_NOT_FOUND, "weight version not found: " + version);
            }
            WeightVector current = active.get();
            if (current != null && current.getVersion() == version) {
                return current;
            }
            LocalDateTime now = LocalDateTime.now(clock);
            LocalDateTime horizon = now.minusDays(weightProperties.getRetentionDays());
            if (target.getCreatedAt() != null && target.getCreatedAt().isBefore(horizon)) {
                throw new BaseException(ErrorCode.WEIGHT_VERSION_EXPIRED,
                        "weight version " + version + " created at " + target.getCreatedAt() + " is beyond retention");
            }
            assertPublishable(target);
            try {
                weightRepository.recordActivation(version, REASON_ROLLBACK, now);
            } catch (RuntimeException e) {
                throw new BaseException(ErrorCode.WEIGHT_PERSIST_FAILED, "record rollback failed, version=" + version, e);
            }
            active.set(target);
            metricsRecorder.recordWeightActivation(REASON_ROLLBACK);
            log.info("权重已回滚: from={}, to={}", current == null ? null : current.getVersion(), version);
            return target;
        }
    }

    /**
     * @return 最近的 limit 个历史版本，新版本在前
     */
    public List<WeightVector> history(int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<WeightVector> snapshot = new ArrayList<>(history);
        Collections.reverse(snapshot);
        return snapshot.size() > limit ? new ArrayList<>(snapshot.subList(0, limit)) : snapshot;
    }

    private long doPublish(WeightVector draft, String source, String reason) {
        long nextVersion = history.isEmpty() ? 1L : history.get(history.size() - 1).getVersion() + 1;
        LocalDateTime now = LocalDateTime.now(clock);
        WeightVector published = draft.publishedAs(nextVersion, now);
        try {
            weightRepository.save(published, source);
        } catch (RuntimeException e) {
            throw new BaseException(ErrorCode.WEIGHT_PERSIST_FAILED, "persist weights failed, version=" + nextVersion, e);
        }
        // 已落库的版本进入历史，即使后续激活失败也可以通过回滚再次启用
        history.add(published);
        try {
            weightRepository.recordActivation(nextVersion, reason, now);
        } catch (RuntimeException e) {
            throw new BaseException(ErrorCode.WEIGHT_PERSIST_FAILED, "record activation failed, version=" + nextVersion, e);
        }
        WeightVector previous = active.getAndSet(published);
        metricsRecorder.recordWeightActivation(reason);
        log.info("权重已发布: version={}, previous={}, source={}", nextVersion,
                previous == null ? null : previous.getVersion(), source);
        return nextVersion;
    }

    private WeightVector find(long version) {
        for (WeightVector w : history) {
            if (w.getVersion() == version) {
                return w;
            }
        }
        return null;
    }

    private static void assertPublishable(WeightVector weights) {
        if (weights.getSchemaVersion() != FeatureKey.SCHEMA_VERSION || !weights.keySet().equals(FeatureKey.schema())) {
            throw new SchemaMismatchException("weights do not match feature schema v" + FeatureKey.SCHEMA_VERSION
                    + ": schema v" + weights.getSchemaVersion() + " keys=" + weights.keySet());
        }
        for (Double w : weights.asMap().values()) {
            if (w == null || !Double.isFinite(w)) {
                throw new IllegalArgumentException("weights must be finite: " + weights.asMap());
            }
        }
    }
}
