package com.tripmatch.server.recommend;

import com.github.benmanes.caffeine.cache.Ticker;
import com.tripmatch.common.exception.BaseException;
import com.tripmatch.common.exception.SchemaMismatchException;
import com.tripmatch.common.properties.CacheProperties;
import com.tripmatch.common.properties.RecommendationProperties;
import com.tripmatch.common.properties.WeightProperties;
import com.tripmatch.common.result.ErrorCode;
import com.tripmatch.pojo.model.Continent;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.ScoredTrip;
import com.tripmatch.pojo.model.SearchPreferences;
import com.tripmatch.pojo.model.TripCandidate;
import com.tripmatch.pojo.model.TripStatus;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.cache.RecommendationCache;
import com.tripmatch.server.metrics.MetricsRecorder;
import com.tripmatch.server.utils.CacheClient;
import com.tripmatch.server.weights.DefaultWeights;
import com.tripmatch.server.weights.WeightRepository;
import com.tripmatch.server.weights.WeightStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.tripmatch.server.support.Fixtures.NOW;
import static com.tripmatch.server.support.Fixtures.preferences;
import static com.tripmatch.server.support.Fixtures.weights;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CandidateSelector 单元测试：
 * - Top-K 的数量、顺序与同分时的稳定性；
 * - 预过滤、并行分片不改变结果；
 * - 非法 k、Schema 不一致、超时。
 */
@ExtendWith(MockitoExtension.class)
class CandidateSelectorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
    private static final long JAPAN = 81L;

    @Mock
    private MetricsRecorder metricsRecorder;

    @Mock
    private WeightStore weightStore;

    @Mock
    private WeightRepository weightRepository;

    private FeatureExtractor featureExtractor;
    private ScoringEngine scoringEngine;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay(ZoneId.of("UTC")).toInstant(), ZoneId.of("UTC"));
        featureExtractor = new FeatureExtractor(clock);
        scoringEngine = new ScoringEngine();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CandidateSelector selector(int parallelThreshold) {
        RecommendationProperties properties = new RecommendationProperties();
        properties.setParallelThreshold(parallelThreshold);
        properties.setWorkerThreads(4);
        return selector(properties, executor);
    }

    private CandidateSelector selector(RecommendationProperties properties, ExecutorService pool) {
        return selector(properties, pool, weightStore);
    }

    private CandidateSelector selector(RecommendationProperties properties, ExecutorService pool, WeightStore store) {
        RecommendationCache cache = new RecommendationCache(
                new CacheClient(metricsRecorder), new CacheProperties(), Ticker.systemTicker());
        return new CandidateSelector(featureExtractor, scoringEngine, cache, store, pool,
                properties, metricsRecorder);
    }

    /**
     * 只保留基础分、国家匹配和时长偏差三项权重，使得分可以手算：
     * 日本 + 时长合适 = 12 + 2×15 = 42；日本 + 超 2 天 = 42 − 2×1.75 = 38.5；非日本 = 12。
     */
    private static WeightVector japanWeights() {
        return weights(1, FeatureKey.BASE_SCORE, 12, FeatureKey.GEO_MATCH_LEVEL, 15,
                FeatureKey.DURATION_DELTA, -1.75);
    }

    private static SearchPreferences japanPreferences() {
        return preferences()
                .countryIds(new TreeSet<>(Set.of(JAPAN)))
                .minDuration(10)
                .maxDuration(14)
                .fingerprint("japan-10-14")
                .build();
    }

    private static TripCandidate trip(long id, long countryId, int duration) {
        return TripCandidate.builder()
                .tripId(id)
                .themeIds(Collections.emptySet())
                .countryId(countryId)
                .durationDays(duration)
                .status(TripStatus.AVAILABLE)
                .build();
    }

    @Test
    void selectTopK_japanScenario_tiesBrokenByTripId() {
        List<TripCandidate> pool = Arrays.asList(
                trip(9, JAPAN, 16), trip(12, 82, 12), trip(3, JAPAN, 12), trip(7, JAPAN, 16));

        List<ScoredTrip> top2 = selector(Integer.MAX_VALUE).selectTopK(pool, japanPreferences(), 2, japanWeights());

        assertEquals(Arrays.asList(3L, 7L), ids(top2));
        assertEquals(42D, top2.get(0).getScore(), 1e-12);
        assertEquals(38.5D, top2.get(1).getScore(), 1e-12);
        assertEquals(1L, top2.get(1).getWeightVersion());

        List<ScoredTrip> all = selector(Integer.MAX_VALUE).selectTopK(pool, japanPreferences(), 10, japanWeights());
        assertEquals(Arrays.asList(3L, 7L, 9L, 12L), ids(all));
        assertEquals(12D, all.get(3).getScore(), 1e-12);
    }

    @Test
    void selectTopK_returnsMinOfNAndKInRankingOrder() {
        List<TripCandidate> pool = randomPool(40, new Random(7));
        CandidateSelector selector = selector(Integer.MAX_VALUE);

        for (int k : new int[]{1, 5, 40, 100}) {
            List<ScoredTrip> top = selector.selectTopK(pool, randomPreferences(), k, DefaultWeights.initial());
            assertEquals(Math.min(k, pool.size()), top.size());
            for (int i = 1; i < top.size(); i++) {
                assertTrue(top.get(i - 1).ranksBefore(top.get(i)), "not in ranking order at " + i);
            }
        }
    }

    @Test
    void selectTopK_matchesFullSortWithPrefilter() {
        List<TripCandidate> pool = randomPool(600, new Random(42));
        SearchPreferences prefs = randomPreferences();
        WeightVector weights = DefaultWeights.initial().publishedAs(1, NOW);

        List<ScoredTrip> expected = pool.stream()
                .map(t -> new ScoredTrip(t, featureExtractor.extract(t, prefs),
                        scoringEngine.score(featureExtractor.extract(t, prefs), weights), 1L))
                .sorted(ScoredTrip.RANKING)
                .limit(15)
                .collect(Collectors.toList());

        List<ScoredTrip> actual = selector(Integer.MAX_VALUE).selectTopK(pool, prefs, 15, weights);

        assertEquals(ids(expected), ids(actual));
        assertEquals(scores(expected), scores(actual));
    }

    @Test
    void selectTopK_parallelEqualsSequential() {
        List<TripCandidate> pool = randomPool(1000, new Random(2026));
        SearchPreferences prefs = randomPreferences();
        WeightVector weights = DefaultWeights.initial().publishedAs(2, NOW);

        List<ScoredTrip> sequential = selector(Integer.MAX_VALUE).selectTopK(pool, prefs, 25, weights);
        List<ScoredTrip> parallel = selector(16).selectTopK(pool, prefs, 25, weights);

        assertEquals(ids(sequential), ids(parallel));
        assertEquals(scores(sequential), scores(parallel));
        verify(metricsRecorder).recordRankLatencyMs(anyLong(), eq(1000), eq(true));
    }

    @Test
    void selectTopK_isIdempotent() {
        List<TripCandidate> pool = randomPool(200, new Random(1));
        SearchPreferences prefs = randomPreferences();
        CandidateSelector selector = selector(Integer.MAX_VALUE);

        List<ScoredTrip> first = selector.selectTopK(pool, prefs, 10, DefaultWeights.initial());
        List<ScoredTrip> second = selector.selectTopK(pool, prefs, 10, DefaultWeights.initial());

        assertEquals(first, second);
    }

    @Test
    void selectTopK_duplicateTripIdKeepsFirstOccurrence() {
        List<TripCandidate> pool = Arrays.asList(trip(5, 82, 12), trip(5, JAPAN, 12), trip(6, 82, 12));

        List<ScoredTrip> top = selector(Integer.MAX_VALUE).selectTopK(pool, japanPreferences(), 10, japanWeights());

        assertEquals(Arrays.asList(5L, 6L), ids(top));
        assertEquals(12D, top.get(0).getScore(), 1e-12);
    }

    @Test
    void selectTopK_usesActiveWeightsWhenNotGiven() {
        when(weightStore.getActive()).thenReturn(japanWeights());

        List<ScoredTrip> top = selector(Integer.MAX_VALUE)
                .selectTopK(Collections.singletonList(trip(3, JAPAN, 12)), japanPreferences(), 1);

        assertEquals(42D, top.get(0).getScore(), 1e-12);
    }

    @Test
    void selectTopK_emptyPoolReturnsEmpty() {
        assertTrue(selector(16).selectTopK(Collections.emptyList(), japanPreferences(), 3, japanWeights()).isEmpty());
    }

    @Test
    void selectTopK_rejectsNonPositiveK() {
        BaseException ex = assertThrows(BaseException.class,
                () -> selector(16).selectTopK(randomPool(3, new Random(3)), japanPreferences(), 0, japanWeights()));
        assertEquals(ErrorCode.INVALID_K, ex.getErrorCode());
    }

    @Test
    void selectTopK_rejectsWeightsFromAnotherSchema() {
        WeightVector stale = WeightVector.restore(9, FeatureKey.SCHEMA_VERSION + 1, NOW, japanWeights().asMap());

        assertThrows(SchemaMismatchException.class,
                () -> selector(16).selectTopK(randomPool(3, new Random(3)), japanPreferences(), 2, stale));
    }

    @Test
    void selectTopK_abortsWhenWorkersDoNotFinishInTime() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch blocker = new CountDownLatch(1);
        single.submit(() -> {
            blocker.await();
            return null;
        });
        RecommendationProperties properties = new RecommendationProperties();
        properties.setParallelThreshold(2);
        properties.setWorkerThreads(2);
        properties.setSelectionTimeoutMs(50);
        try {
            BaseException ex = assertThrows(BaseException.class, () -> selector(properties, single)
                    .selectTopK(randomPool(10, new Random(5)), randomPreferences(), 3, DefaultWeights.initial()));
            assertEquals(ErrorCode.RANK_ABORTED, ex.getErrorCode());
        } finally {
            blocker.countDown();
            single.shutdownNow();
        }
    }

    @Test
    void selectTopK_scoreCacheIsKeyedByWeightVersion() {
        CandidateSelector selector = selector(Integer.MAX_VALUE);
        List<TripCandidate> pool = Collections.singletonList(trip(3, JAPAN, 12));
        WeightVector v1 = japanWeights();
        WeightVector v2 = weights(2, FeatureKey.BASE_SCORE, 50);

        ScoredTrip first = selector.selectTopK(pool, japanPreferences(), 1, v1).get(0);
        ScoredTrip cached = selector.selectTopK(pool, japanPreferences(), 1, v1).get(0);
        ScoredTrip afterPublish = selector.selectTopK(pool, japanPreferences(), 1, v2).get(0);

        assertEquals(first, cached);
        verify(metricsRecorder, times(1)).recordCacheAccess("score", "hit");
        assertEquals(2L, afterPublish.getWeightVersion());
        assertEquals(50D, afterPublish.getScore(), 1e-12);
    }

    /**
     * 同一 tripId 的价格与状态变化后，必须按本次传入的候选重新打分，返回的也是本次的候选。
     */
    @Test
    void selectTopK_changedCandidateIsNotServedFromCache() {
        CandidateSelector selector = selector(Integer.MAX_VALUE);
        WeightVector weights = weights(1, FeatureKey.BASE_SCORE, 10, FeatureKey.BUDGET_RATIO, -5,
                FeatureKey.STATUS_CODE, 3);
        SearchPreferences prefs = preferences().budget(12000D).fingerprint("budget-12000").build();

        List<ScoredTrip> first = selector.selectTopK(Arrays.asList(
                priced(1, "6000", TripStatus.AVAILABLE), priced(2, "6000", TripStatus.AVAILABLE)), prefs, 1, weights);
        assertEquals(1L, first.get(0).getTripId());

        TripCandidate repriced = priced(1, "36000", TripStatus.LAST_PLACES);
        List<ScoredTrip> all = selector.selectTopK(Arrays.asList(
                repriced, priced(2, "6000", TripStatus.AVAILABLE)), prefs, 2, weights);

        assertEquals(Arrays.asList(2L, 1L), ids(all));
        assertEquals(7.5D, all.get(0).getScore(), 1e-12);
        assertEquals(1D, all.get(1).getScore(), 1e-12);
        assertSame(repriced, all.get(1).getTrip());
        assertEquals(2L, selector.selectTopK(Arrays.asList(
                repriced, priced(2, "6000", TripStatus.AVAILABLE)), prefs, 1, weights).get(0).getTripId());
    }

    /**
     * 回滚后下一次打分使用回滚到的版本，并复用该版本之前缓存的得分。
     */
    @Test
    void selectTopK_afterRollbackScoresWithRestoredVersion() {
        WeightVector v1 = japanWeights();
        WeightVector v2 = weights(2, FeatureKey.BASE_SCORE, 50);
        when(weightRepository.loadAll()).thenReturn(Arrays.asList(v1, v2));
        when(weightRepository.loadActiveVersion()).thenReturn(1L);
        Clock clock = Clock.fixed(NOW.atZone(ZoneId.systemDefault()).toInstant(), ZoneId.systemDefault());
        WeightStore store = new WeightStore(weightRepository, new WeightProperties(), metricsRecorder, clock);
        store.init();
        RecommendationProperties properties = new RecommendationProperties();
        properties.setParallelThreshold(Integer.MAX_VALUE);
        CandidateSelector selector = selector(properties, executor, store);
        List<TripCandidate> pool = Collections.singletonList(trip(3, JAPAN, 12));

        assertEquals(1L, selector.selectTopK(pool, japanPreferences(), 1).get(0).getWeightVersion());
        store.rollback(2L);
        assertEquals(2L, selector.selectTopK(pool, japanPreferences(), 1).get(0).getWeightVersion());
        store.rollback(1L);
        ScoredTrip restored = selector.selectTopK(pool, japanPreferences(), 1).get(0);

        assertEquals(1L, restored.getWeightVersion());
        assertEquals(42D, restored.getScore(), 1e-12);
        verify(metricsRecorder, times(1)).recordCacheAccess("score", "hit");
        verify(metricsRecorder, times(2)).recordCacheAccess("score", "miss");
    }

    private static TripCandidate priced(long id, String price, TripStatus status) {
        return TripCandidate.builder()
                .tripId(id)
                .themeIds(Collections.emptySet())
                .durationDays(10)
                .price(new BigDecimal(price))
                .status(status)
                .build();
    }

    private List<TripCandidate> randomPool(int size, Random random) {
        List<TripCandidate> pool = new ArrayList<>(size);
        Continent[] continents = Continent.values();
        TripStatus[] statuses = TripStatus.values();
        for (int i = 0; i < size; i++) {
            Set<Long> themes = new HashSet<>();
            int themeCount = random.nextInt(4);
            for (int t = 0; t < themeCount; t++) {
                themes.add(1L + random.nextInt(8));
            }
            pool.add(TripCandidate.builder()
                    .tripId(1000L + i)
                    .themeIds(themes)
                    .tripTypeId(1L + random.nextInt(4))
                    .difficulty(1 + random.nextInt(5))
                    .durationDays(3 + random.nextInt(25))
                    .price(BigDecimal.valueOf(500 + random.nextInt(6000)))
                    .countryId(80L + random.nextInt(6))
                    .continent(continents[random.nextInt(continents.length)])
                    .status(statuses[random.nextInt(statuses.length)])
                    .departureDate(TODAY.plusDays(random.nextInt(500)))
                    .build());
        }
        return pool;
    }

    private static SearchPreferences randomPreferences() {
        return preferences()
                .countryIds(new TreeSet<>(Set.of(81L, 83L)))
                .continents(new TreeSet<>(Set.of(Continent.EUROPE)))
                .themeIds(new TreeSet<>(Set.of(2L, 5L)))
                .tripTypeId(2L)
                .budget(3000D)
                .difficulty(3)
                .minDuration(7)
                .maxDuration(14)
                .year(2026)
                .fingerprint("random-prefs")
                .build();
    }

    private static List<Long> ids(List<ScoredTrip> trips) {
        return trips.stream().map(ScoredTrip::getTripId).collect(Collectors.toList());
    }

    private static List<Double> scores(List<ScoredTrip> trips) {
        return trips.stream().map(ScoredTrip::getScore).collect(Collectors.toList());
    }
}
