package com.tripmatch.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 权重版本历史表，只追加不修改。
 */
@Data
@TableName("weight_version")
public class WeightVersion {

    /** 权重版本号，由 WeightStore 分配 */
    @TableId(type = IdType.INPUT)
    private Long version;

    private Integer schemaVersion;

    /** {"BASE_SCORE":30.0,"THEME_MATCH_LEVEL":12.5,...} */
    private String weightsJson;

    /** DEFAULT / TRAINING */
    private String source;

    private LocalDateTime createTime;
}
