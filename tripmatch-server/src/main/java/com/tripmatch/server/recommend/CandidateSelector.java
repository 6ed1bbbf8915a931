package com.tripmatch.server.recommend;

import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.properties.RecommendationProperties;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.ScoredTrip;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.cache.CachedScore;
import com.tripmatch.server.cache.RecommendationCache;
import com.tripmatch.server.metrics.MetricsRecorder;
import com.tripmatch.server.weights.WeightStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-K 候选选择。
 *
 * <p>对每个候选做（带缓存的）特征提取与打分，用容量为 k 的最小堆保留最优结果，内存 O(k)，比较次数 O(n log k)。
 * 候选数量达到阈值时按连续分片提交到固定大小的线程池，每个分片维护自己的堆，最后在调用线程内顺序合并；
 * 排序规则是全序（得分降序 + tripId 升序），结果与线程调度无关。</p>
 *
 * <p>堆已满时，若候选的得分上界严格小于堆顶得分则跳过特征提取，不会改变最终结果。</p>
 */
@Component
@Slf4j
public class CandidateSelector {

    private final FeatureExtractor featureExtractor;
    private final ScoringEngine scoringEngine;
    private final RecommendationCache recommendationCache;
    private final WeightStore weightStore;
    private final ExecutorService scoringExecutor;
    private final RecommendationProperties properties;
    private final MetricsRecorder metricsRecorder;

    public CandidateSelector(FeatureExtractor featureExtractor,
                             ScoringEngine scoringEngine,
                             RecommendationCache recommendationCache,
                             WeightStore weightStore,
                             @Qualifier("scoringExecutor") ExecutorService scoringExecutor,
                             RecommendationProperties properties,
                             MetricsRecorder metricsRecorder) {
        this.featureExtractor = featureExtractor;
        this.scoringEngine = scoringEngine;
        this.recommendationCache = recommendationCache;
        this.weightStore = weightStore;
        this.scoringExecutor = scoringExecutor;
        this.properties = properties;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 使用当前线上权重选择 Top-K。
     */
    public List<ScoredTrip> selectTopK(List<TripCandidate> candidates, SearchPreferences preferences, int k) {
        return selectTopK(candidates, preferences, k, weightStore.getActive());
    }

    /**
     * @param weights 本次请求开始时捕获的权重快照，所有候选都用它打分
     * @return 至多 k 条结果，得分降序，同分按 tripId 升序
     */
    public List<ScoredTrip> selectTopK(List<TripCandidate> candidates, SearchPreferences preferences,
                                       int k, WeightVector weights) {
        if (k <= 0) {
            throw new BaseException(ErrorCode.INVALID_K, "k must be positive: " + k);
        }
        if (candidates == null || candidates.isEmpty()) {
            return Collections.emptyList();
        }
        featureExtractor.checkSchema(weights);

        long start = System.nanoTime();
        List<TripCandidate> unique = dedupe(candidates);
        boolean parallel = unique.size() >= properties.getParallelThreshold() && properties.getWorkerThreads() > 1;
        AtomicInteger skipped = new AtomicInteger();
        List<ScoredTrip> result = parallel
                ? selectParallel(unique, preferences, k, weights, skipped)
                : scoreChunk(unique, preferences, k, weights, skipped);

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metricsRecorder.recordRankLatencyMs(latencyMs, unique.size(), parallel);
        metricsRecorder.recordPrefilterSkipped(skipped.get());
        log.debug("Top-K 选择完成: candidates={}, k={}, returned={}, skipped={}, parallel={}, weightVersion={}, costMs={}",
                unique.size(), k, result.size(), skipped.get(), parallel, weights.getVersion(), latencyMs);
        return result;
    }

    private List<ScoredTrip> selectParallel(List<TripCandidate> candidates, SearchPreferences preferences,
                                            int k, WeightVector weights, AtomicInteger skipped) {
        int workers = properties.getWorkerThreads();
        int chunkSize = (candidates.size() + workers - 1) / workers;
        List<Future<List<ScoredTrip>>> futures = new ArrayList<>(workers);
        for (int from = 0; from < candidates.size(); from += chunkSize) {
            List<TripCandidate> chunk = candidates.subList(from, Math.min(candidates.size(), from + chunkSize));
            futures.add(scoringExecutor.submit(() -> scoreChunk(chunk, preferences, k, weights, skipped)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(properties.getSelectionTimeoutMs());
        BoundedTopK merged = new BoundedTopK(k);
        try {
            // 按分片顺序合并，合并本身在调用线程内串行完成
            for (Future<List<ScoredTrip>> future : futures) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                merged.offerAll(future.get(remaining, TimeUnit.NANOSECONDS));
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new BaseException(ErrorCode.RANK_ABORTED, "rank interrupted by caller", e);
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new BaseException(ErrorCode.RANK_ABORTED,
                    "rank timed out after " + properties.getSelectionTimeoutMs() + "ms", e);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("scoring worker failed", cause);
        }
        return merged.toSortedList();
    }

    private List<ScoredTrip> scoreChunk(List<TripCandidate> chunk, SearchPreferences preferences,
                                        int k, WeightVector weights, AtomicInteger skipped) {
        BoundedTopK heap = new BoundedTopK(k);
        for (TripCandidate candidate : chunk) {
            if (Thread.currentThread().isInterrupted()) {
                throw new BaseException(ErrorCode.RANK_ABORTED, "rank cancelled");
            }
            if (heap.isFull() && featureExtractor.upperBound(candidate, weights) < heap.worst().getScore()) {
                skipped.incrementAndGet();
                continue;
            }
            CachedScore cached = recommendationCache.score(candidate, preferences.getFingerprint(),
                    weights.getVersion(), () -> score(candidate, preferences, weights));
            // 结果总是挂在本次请求传入的候选上
            heap.offer(new ScoredTrip(candidate, cached.getFeatures(), cached.getScore(), weights.getVersion()));
        }
        return heap.toSortedList();
    }

    private CachedScore score(TripCandidate candidate, SearchPreferences preferences, WeightVector weights) {
        FeatureVector features = featureExtractor.extract(candidate, preferences);
        return new CachedScore(features, scoringEngine.score(features, weights));
    }

    /**
     * 同一个 tripId 只保留第一次出现的候选。
     */
    private static List<TripCandidate> dedupe(List<TripCandidate> candidates) {
        Set<Long> seen = new HashSet<>();
        List<TripCandidate> unique = new ArrayList<>(candidates.size());
        for (TripCandidate c : candidates) {
            if (c != null && seen.add(c.getTripId())) {
                unique.add(c);
            }
        }
        return unique;
    }

    private static void cancelAll(List<Future<List<ScoredTrip>>> futures) {
        for (Future<List<ScoredTrip>> f : futures) {
            f.cancel(true);
        }
    }
}
