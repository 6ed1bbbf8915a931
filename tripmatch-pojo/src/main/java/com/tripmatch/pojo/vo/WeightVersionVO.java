package com.tripmatch.pojo.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

@Data
public class WeightVersionVO {

    private Long version;

    private Integer schemaVersion;

    private LocalDateTime createTime;

    private Boolean active;

    private Map<String, Double> weights;
}
