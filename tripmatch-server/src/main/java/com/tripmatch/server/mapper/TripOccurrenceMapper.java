package com.tripmatch.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tripmatch.pojo.entity.TripOccurrence;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface TripOccurrenceMapper extends BaseMapper<TripOccurrence> {
}
