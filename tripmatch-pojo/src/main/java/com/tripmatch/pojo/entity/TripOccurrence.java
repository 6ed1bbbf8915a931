package com.tripmatch.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 出团库存只读视图（由库存服务维护，推荐核心只查询）。
 */
@Data
@TableName("trip_occurrence")
public class TripOccurrence {

    @TableId(type = IdType.AUTO)
    private Long id;

    private Long templateId;

    private Long tripTypeId;

    private Integer difficultyLevel;

    private Integer durationDays;

    private BigDecimal effectivePrice;

    private Long primaryCountryId;

    /**
     * 大洲枚举名，如 ASIA、NORTH_AND_CENTRAL_AMERICA
     */
    private String continent;

    /**
     * Open / Guaranteed / Last Places / Full / Cancelled
     */
    private String status;

    private LocalDate startDate;

    private Integer spotsLeft;

    /**
     * 主题标签 id，逗号分隔，例如 "3,7,12"
     */
    private String themeTagIds;

    private Boolean isActive;
}
