package com.tripmatch.server.training;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.tripmatch.pojo.entity.RecommendationImpression;
import com.tripmatch.server.mapper.RecommendationImpressionMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
@Slf4j
public class MybatisTrainingExampleSource implements TrainingExampleSource {

    private final RecommendationImpressionMapper recommendationImpressionMapper;

    @Override
    public List<RecommendationImpression> fetchWindow(LocalDateTime from, LocalDateTime to) {
        List<RecommendationImpression> rows = recommendationImpressionMapper.selectList(
                new LambdaQueryWrapper<RecommendationImpression>()
                        .ge(RecommendationImpression::getCreateTime, from)
                        .lt(RecommendationImpression::getCreateTime, to)
                        .orderByAsc(RecommendationImpression::getId));
        log.info("拉取训练样本窗口: from={}, to={}, rows={}", from, to, rows.size());
        return rows;
    }
}
