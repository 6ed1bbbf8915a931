package com.tripmatch.pojo.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 特征 key 的封闭枚举，特征向量与权重向量共用这一组 key。
 * <p>新增或删除 key 必须同时提升 {@link #SCHEMA_VERSION}，旧版本的权重向量会被判定为 Schema 不一致。</p>
 * <p>类别型匹配（主题、地理、状态、日期）编码为 0/1/2 小整数等级，而不是 one-hot。</p>
 */
public enum FeatureKey {

    /** 常量 1.0，对应的权重即"基础分"，训练后约束为非负 */
    BASE_SCORE(1D, 1D),

    /** 0=无匹配或未选主题，1=命中 1 个主题，2=命中 2 个及以上 */
    THEME_MATCH_LEVEL(0D, 2D),

    /** 选了主题但一个都没命中时为 1 */
    THEME_MISMATCH(0D, 1D),

    TRIP_TYPE_MATCH(0D, 1D),

    /** |行程难度 - 目标难度|，未指定目标时为 0 */
    DIFFICULTY_DELTA(0D, 4D),

    /** 行程天数超出期望区间的天数 */
    DURATION_DELTA(0D, 30D),

    /** 价格 / 预算，未指定预算时为 0 */
    BUDGET_RATIO(0D, 3D),

    /** 0=可报名，1=成团保证，2=最后名额 */
    STATUS_CODE(0D, 2D),

    /** 距出发天数 / 365，归一化到 [0, 1] */
    DAYS_UNTIL_DEPARTURE(0D, 1D),

    /** 0=无匹配，1=大洲匹配，2=国家匹配 */
    GEO_MATCH_LEVEL(0D, 2D),

    /** 0=未指定或不匹配，1=年份匹配，2=年份+月份匹配 */
    DATE_MATCH_LEVEL(0D, 2D);

    /** 当前特征 Schema 版本 */
    public static final int SCHEMA_VERSION = 1;

    private static final Set<FeatureKey> ALL = Collections.unmodifiableSet(EnumSet.allOf(FeatureKey.class));

    private final double lowerBound;
    private final double upperBound;

    FeatureKey(double lowerBound, double upperBound) {
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public double clamp(double value) {
        return Math.max(lowerBound, Math.min(upperBound, value));
    }

    /**
     * 当前 Schema 下的完整 key 集合。
     */
    public static Set<FeatureKey> schema() {
        return ALL;
    }
}
