package com.tripmatch.server.training;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmatch.common.properties.TrainingProperties;
import com.tripmatch.pojo.entity.RecommendationImpression;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.FeatureVector;
import com.tripmatch.pojo.model.TrainingExample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 训练数据准备：过滤无效记录、确定性排序、按 sessionId 稳定哈希划分训练集 / 验证集。
 *
 * <p>无效记录包括：缺少会话 / 行程 / 特征 / 位置 / 标签 / 时间；位置为负；特征无法解析为当前 Schema；
 * 停留时长为负或超过上限；被标记为机器人的会话。</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrainingDataPreparer {

    private static final int BUCKETS = 100;

    static final Comparator<TrainingExample> DETERMINISTIC_ORDER = Comparator
            .comparing(TrainingExample::getSessionId)
            .thenComparing(TrainingExample::getTimestamp)
            .thenComparing(TrainingExample::getTripId)
            .thenComparingInt(TrainingExample::getPosition);

    private final ObjectMapper objectMapper;
    private final TrainingProperties trainingProperties;

    public TrainingDataset prepare(List<RecommendationImpression> rows) {
        List<TrainingExample> valid = new ArrayList<>(rows.size());
        int rejected = 0;
        for (RecommendationImpression row : rows) {
            TrainingExample example = toExample(row);
            if (example == null) {
                rejected++;
            } else {
                valid.add(example);
            }
        }
        valid.sort(DETERMINISTIC_ORDER);

        List<TrainingExample> train = new ArrayList<>();
        List<TrainingExample> validation = new ArrayList<>();
        for (TrainingExample example : valid) {
            if (isValidationSession(example.getSessionId())) {
                validation.add(example);
            } else {
                train.add(example);
            }
        }
        if (rejected > 0) {
            log.info("训练样本过滤: collected={}, rejected={}", rows.size(), rejected);
        }
        return new TrainingDataset(rows.size(), rejected,
                Collections.unmodifiableList(train), Collections.unmodifiableList(validation));
    }

    /**
     * 同一个会话的所有样本总是落在同一侧，避免同一次浏览同时出现在训练集与验证集。
     */
    boolean isValidationSession(String sessionId) {
        return bucketOf(sessionId) < trainingProperties.getValidationPercent();
    }

    static int bucketOf(String sessionId) {
        byte[] digest = DigestUtils.md5Digest(sessionId.getBytes(StandardCharsets.UTF_8));
        int high = ((digest[0] & 0xff) << 8) | (digest[1] & 0xff);
        return high % BUCKETS;
    }

    TrainingExample toExample(RecommendationImpression row) {
        if (row == null
                || !StringUtils.hasText(row.getSessionId())
                || row.getTripId() == null
                || row.getRankPosition() == null || row.getRankPosition() < 0
                || row.getClicked() == null
                || row.getCreateTime() == null
                || Boolean.TRUE.equals(row.getBotFlag())) {
            return null;
        }
        Integer dwell = row.getDwellSeconds();
        if (dwell != null && (dwell < 0 || dwell > trainingProperties.getMaxDwellSeconds())) {
            return null;
        }
        FeatureVector features = parseFeatures(row);
        if (features == null) {
            return null;
        }
        return TrainingExample.builder()
                .sessionId(row.getSessionId())
                .tripId(row.getTripId())
                .features(features)
                .position(row.getRankPosition())
                .clicked(row.getClicked())
                .dwellSeconds(dwell)
                .converted(row.getConverted())
                .timestamp(row.getCreateTime())
                .build();
    }

    private FeatureVector parseFeatures(RecommendationImpression row) {
        if (row.getSchemaVersion() == null || row.getSchemaVersion() != FeatureKey.SCHEMA_VERSION
                || !StringUtils.hasText(row.getFeaturesJson())) {
            return null;
        }
        Map<String, Double> raw;
        try {
            raw = objectMapper.readValue(row.getFeaturesJson(), new TypeReference<Map<String, Double>>() {
            });
        } catch (JsonProcessingException e) {
            log.debug("特征 JSON 解析失败: id={}, error={}", row.getId(), e.getMessage());
            return null;
        }
        if (raw == null || raw.size() != FeatureKey.values().length) {
            return null;
        }
        Map<FeatureKey, Double> values = new EnumMap<>(FeatureKey.class);
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            FeatureKey key;
            try {
                key = FeatureKey.valueOf(e.getKey());
            } catch (IllegalArgumentException unknown) {
                return null;
            }
            if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                return null;
            }
            values.put(key, e.getValue());
        }
        return FeatureVector.of(values);
    }
}
