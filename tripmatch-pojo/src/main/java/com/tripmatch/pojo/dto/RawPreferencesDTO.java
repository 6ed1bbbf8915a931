package com.tripmatch.pojo.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 前端提交的原始搜索偏好，未经归一化。
 */
@Data
public class RawPreferencesDTO {

    private List<Long> selectedCountries;

    /** 大洲展示名或枚举名，如 "Asia"、"North & Central America" */
    private List<String> selectedContinents;

    private Long preferredTypeId;

    private List<Long> preferredThemeIds;

    private Integer minDuration;

    private Integer maxDuration;

    private BigDecimal budget;

    private Integer difficulty;

    /** "2026" 或 "all" */
    private String year;

    /** "1".."12" 或 "all" */
    private String month;
}
