package com.tripmatch.server.weights;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tripmatch.pojo.entity.WeightActivation;
import com.tripmatch.pojo.entity.WeightVersion;
import com.tripmatch.pojo.model.FeatureKey;
import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.server.mapper.WeightActivationMapper;
import com.tripmatch.server.mapper.WeightVersionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MybatisWeightRepository implements WeightRepository {

    private final WeightVersionMapper weightVersionMapper;
    private final WeightActivationMapper weightActivationMapper;
    private final ObjectMapper objectMapper;

    @Override
    public List<WeightVector> loadAll() {
        List<WeightVersion> rows = weightVersionMapper.selectList(
                new LambdaQueryWrapper<WeightVersion>().orderByAsc(WeightVersion::getVersion));
        List<WeightVector> result = new ArrayList<>(rows.size());
        for (WeightVersion row : rows) {
            result.add(toVector(row));
        }
        return result;
    }

    @Override
    public Long loadActiveVersion() {
        return weightActivationMapper.selectLatestActiveVersion();
    }

    @Override
    public void save(WeightVector published, String source) {
        WeightVersion row = new WeightVersion();
        row.setVersion(published.getVersion());
        row.setSchemaVersion(published.getSchemaVersion());
        row.setSource(source);
        row.setCreateTime(published.getCreatedAt());
        try {
            Map<String, Double> json = new LinkedHashMap<>();
            published.asMap().forEach((k, v) -> json.put(k.name(), v));
            row.setWeightsJson(objectMapper.writeValueAsString(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("serialize weights failed, version=" + published.getVersion(), e);
        }
        weightVersionMapper.insert(row);
    }

    @Override
    public void recordActivation(long version, String reason, LocalDateTime activateTime) {
        WeightActivation row = new WeightActivation();
        row.setVersion(version);
        row.setReason(reason);
        row.setActivateTime(activateTime);
        weightActivationMapper.insert(row);
    }

    /**
     * 还原持久化的权重。遇到当前构建不认识的 key（来自更新的 Schema）时跳过该 key 并保留原 Schema 版本，
     * 这样的版本一旦被激活会在打分前被判定为 Schema 不一致，而不是被悄悄补零。
     */
    WeightVector toVector(WeightVersion row) {
        Map<String, Double> raw;
        try {
            raw = objectMapper.readValue(row.getWeightsJson(), new TypeReference<Map<String, Double>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("corrupted weights json, version=" + row.getVersion(), e);
        }
        Map<FeatureKey, Double> weights = new EnumMap<>(FeatureKey.class);
        for (Map.Entry<String, Double> e : raw.entrySet()) {
            try {
                weights.put(FeatureKey.valueOf(e.getKey()), e.getValue());
            } catch (IllegalArgumentException unknown) {
                log.warn("权重版本包含未知特征 key，已跳过: version={}, key={}", row.getVersion(), e.getKey());
            }
        }
        int schemaVersion = row.getSchemaVersion() == null ? FeatureKey.SCHEMA_VERSION : row.getSchemaVersion();
        return WeightVector.restore(row.getVersion(), schemaVersion, row.getCreateTime(), weights);
    }
}
