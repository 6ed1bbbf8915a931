package com.tripmatch.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripmatch.pojo.entity.RecommendationImpression;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface RecommendationImpressionMapper extends BaseMapper<RecommendationImpression> {
}
