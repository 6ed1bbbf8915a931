package com.tripmatch.server.service.impl;

import com.tripmatch.pojo.model.WeightVector;
import com.tripmatch.pojo.vo.TrainingRunVO;
import com.tripmatch.pojo.vo.WeightVersionVO;
import com.tripmatch.server.service.WeightAdminService;
import com.tripmatch.server.training.TrainingPipeline;
import com.tripmatch.server.weights.WeightStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class WeightAdminServiceImpl implements WeightAdminService {

    private final WeightStore weightStore;
    private final TrainingPipeline trainingPipeline;

    @Override
    public WeightVersionVO getActive() {
        WeightVector active = weightStore.getActive();
        return toVO(active, active.getVersion());
    }

    @Override
    public List<WeightVersionVO> history(int limit) {
        long activeVersion = weightStore.getActive().getVersion();
        List<WeightVector> versions = weightStore.history(limit);
        List<WeightVersionVO> result = new ArrayList<>(versions.size());
        for (WeightVector v : versions) {
            result.add(toVO(v, activeVersion));
        }
        return result;
    }

    @Override
    public WeightVersionVO rollback(long version) {
        log.info("管理端请求回滚权重: version={}", version);
        WeightVector active = weightStore.rollback(version);
        return toVO(active, active.getVersion());
    }

    @Override
    public TrainingRunVO triggerTraining() {
        log.info("管理端手动触发训练");
        return trainingPipeline.run("admin");
    }

    @Override
    public TrainingRunVO lastTrainingRun() {
        return trainingPipeline.getLastReport();
    }

    static WeightVersionVO toVO(WeightVector weights, long activeVersion) {
        WeightVersionVO vo = new WeightVersionVO();
        vo.setVersion(weights.getVersion());
        vo.setSchemaVersion(weights.getSchemaVersion());
        vo.setCreateTime(weights.getCreatedAt());
        vo.setActive(weights.getVersion() == activeVersion);
        Map<String, Double> map = new LinkedHashMap<>();
        weights.asMap().forEach((k, v) -> map.put(k.name(), v));
        vo.setWeights(map);
        return vo;
    }
}
