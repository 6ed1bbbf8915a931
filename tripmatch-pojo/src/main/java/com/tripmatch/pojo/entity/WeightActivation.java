package com.tripmatch.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 权重激活日志：每次发布 / 回滚追加一条，最新一条即重启后的线上版本。
 */
@Data
@TableName("weight_activation")
public class WeightActivation {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long version;

    /** BOOTSTRAP / PUBLISH / ROLLBACK */
    private String reason;

    private LocalDateTime activateTime;
}
