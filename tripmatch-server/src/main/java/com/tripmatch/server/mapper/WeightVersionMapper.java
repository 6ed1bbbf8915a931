package com.tripmatch.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripmatch.pojo.entity.WeightVersion;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WeightVersionMapper extends BaseMapper<WeightVersion> {
}
