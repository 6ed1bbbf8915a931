package com.tripmatch.pojo.vo;

import lombok.Data;

import java.util.List;

@Data
public class RankResultVO {

    /** 本次排序使用的权重版本 */
    private Long weightVersion;

    /** 归一化偏好的指纹，可用于埋点关联 */
    private String preferenceFingerprint;

    private Integer candidateCount;

    private List<ScoredTripVO> trips;

    /** 放宽条件后补充的行程，已计入放宽扣分；rank 接口恒为空 */
    private List<ScoredTripVO> relaxedTrips;
}
