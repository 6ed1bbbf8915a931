package com.tripmatch.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripmatch.pojo.entity.WeightActivation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface WeightActivationMapper extends BaseMapper<WeightActivation> {

    /**
     * 最近一次激活的权重版本；激活日志为空时返回 null。
     */
    @Select("SELECT version FROM weight_activation ORDER BY id DESC LIMIT 1")
    Long selectLatestActiveVersion();
}
