package com.tripmatch.pojo.vo;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * 排序结果中的单条行程。
 * Ranked trip with score, match level and per-feature contributions.
 */
@Data
public class ScoredTripVO {

    /** 名次，从 1 开始 */
    private Integer rank;

    private Long tripId;

    private Double score;

    /** HIGH (>=70) / MID (>=50) / LOW，前端据此着色 */
    private String matchLevel;

    private Long weightVersion;

    private BigDecimal price;

    private LocalDate departureDate;

    private String status;

    /** 是否来自放宽条件的补充结果 */
    private Boolean relaxed;

    /**
     * 各特征的得分贡献（权重 × 特征值），用于解释推荐理由。
     */
    private Map<String, Double> contributions;
}
