package com.tripmatch.server.training;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmatch.common.properties.TrainingProperties;
import com.tripmatch.pojo.entity.RecommendationImpression;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.TrainingExample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * TrainingDataPreparer 单元测试：无效记录过滤、确定性排序与按会话稳定划分。
 */
class TrainingDataPreparerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 2, 20, 12, 0);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private TrainingProperties properties;
    private TrainingDataPreparer preparer;

    @BeforeEach
    void setUp() {
        properties = new TrainingProperties();
        preparer = new TrainingDataPreparer(objectMapper, properties);
    }

    private RecommendationImpression row(String session, long tripId, int position, boolean clicked) throws Exception {
        Map<String, Double> features = new LinkedHashMap<>();
        for (FeatureKey key : FeatureKey.values()) {
            features.put(key.name(), key == FeatureKey.BASE_SCORE ? 1D : 0.5D);
        }
        RecommendationImpression row = new RecommendationImpression();
        row.setId(tripId);
        row.setSessionId(session);
        row.setTripId(tripId);
        row.setRankPosition(position);
        row.setClicked(clicked);
        row.setDwellSeconds(30);
        row.setBotFlag(false);
        row.setSchemaVersion(FeatureKey.SCHEMA_VERSION);
        row.setFeaturesJson(objectMapper.writeValueAsString(features));
        row.setCreateTime(T0.plusMinutes(tripId));
        return row;
    }

    private RecommendationImpression broken(Consumer<RecommendationImpression> breaker) throws Exception {
        RecommendationImpression r = row("bad", 99L, 0, true);
        breaker.accept(r);
        return r;
    }

    @Test
    void toExample_acceptsValidRow() throws Exception {
        TrainingExample example = preparer.toExample(row("s1", 3L, 2, true));

        assertNotNull(example);
        assertEquals(2, example.getPosition());
        assertEquals(1D, example.label());
        assertEquals(FeatureKey.schema(), example.getFeatures().keySet());
    }

    @Test
    void prepare_rejectsInvalidRecords() throws Exception {
        List<RecommendationImpression> rows = new ArrayList<>(Arrays.asList(
                row("s1", 1L, 0, true),
                broken(r -> r.setSessionId(" ")),
                broken(r -> r.setTripId(null)),
                broken(r -> r.setRankPosition(-1)),
                broken(r -> r.setClicked(null)),
                broken(r -> r.setCreateTime(null)),
                broken(r -> r.setBotFlag(true)),
                broken(r -> r.setDwellSeconds(-5)),
                broken(r -> r.setDwellSeconds(properties.getMaxDwellSeconds() + 1)),
                broken(r -> r.setSchemaVersion(FeatureKey.SCHEMA_VERSION + 1)),
                broken(r -> r.setFeaturesJson("{not json")),
                broken(r -> r.setFeaturesJson("{\"BASE_SCORE\":1.0}")),
                broken(r -> r.setFeaturesJson(r.getFeaturesJson().replace("DATE_MATCH_LEVEL", "SEASONALITY")))));

        TrainingDataset dataset = preparer.prepare(rows);

        assertEquals(13, dataset.getCollected());
        assertEquals(12, dataset.getRejected());
        assertEquals(1, dataset.usable());
    }

    @Test
    void prepare_missingDwellIsAllowed() throws Exception {
        RecommendationImpression r = row("s1", 1L, 0, false);
        r.setDwellSeconds(null);

        assertNotNull(preparer.toExample(r));
        assertNull(preparer.toExample(r).getDwellSeconds());
    }

    @Test
    void prepare_sessionsNeverStraddlePartitions() throws Exception {
        List<RecommendationImpression> rows = new ArrayList<>();
        long id = 1;
        for (int s = 0; s < 200; s++) {
            for (int p = 0; p < 3; p++) {
                rows.add(row("session-" + s, id++, p, p == 0));
            }
        }

        TrainingDataset dataset = preparer.prepare(rows);

        assertEquals(600, dataset.usable());
        assertTrue(dataset.getValidation().size() > 0);
        assertTrue(dataset.getTrain().size() > 0);
        for (TrainingExample e : dataset.getValidation()) {
            assertTrue(preparer.isValidationSession(e.getSessionId()));
        }
        for (TrainingExample e : dataset.getTrain()) {
            assertTrue(!preparer.isValidationSession(e.getSessionId()));
        }
    }

    @Test
    void prepare_orderIsIndependentOfInputOrder() throws Exception {
        List<RecommendationImpression> rows = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            rows.add(row("session-" + (i % 7), i, i % 4, i % 3 == 0));
        }
        List<RecommendationImpression> reversed = new ArrayList<>(rows);
        java.util.Collections.reverse(reversed);

        TrainingDataset a = preparer.prepare(rows);
        TrainingDataset b = preparer.prepare(reversed);

        assertEquals(a.getTrain(), b.getTrain());
        assertEquals(a.getValidation(), b.getValidation());
    }

    @Test
    void bucketOf_isStable() {
        assertEquals(TrainingDataPreparer.bucketOf("abc"), TrainingDataPreparer.bucketOf("abc"));
        assertTrue(TrainingDataPreparer.bucketOf("abc") >= 0 && TrainingDataPreparer.bucketOf("abc") < 100);

        properties.setValidationPercent(0);
        assertTrue(!preparer.isValidationSession("abc"));
        properties.setValidationPercent(100);
        assertTrue(preparer.isValidationSession("abc"));
    }
}
