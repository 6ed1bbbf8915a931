package com.tripmatch.pojo.model;

import lombok.Builder;
import lombok.Value;

import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * 归一化后的搜索偏好，不可变。
 * <p>集合字段一律为有序集合，{@link #canonicalForm()} 对相同输入逐字节一致，是缓存 key 的基础。</p>
 */
@Value
@Builder(toBuilder = true)
public class SearchPreferences {

    SortedSet<Long> countryIds;

    SortedSet<Continent> continents;

    Long tripTypeId;

    SortedSet<Long> themeIds;

    /** 预算上限，null 表示不限 */
    Double budget;

    int minDuration;

    int maxDuration;

    /** 目标难度 1..5，null 表示不限 */
    Integer difficulty;

    Integer year;

    /** 仅在 year 非空时有意义 */
    Integer month;

    /** canonicalForm 的摘要，由归一化器计算 */
    String fingerprint;

    public boolean hasGeography() {
        return !countryIds.isEmpty() || !continents.isEmpty();
    }

    public String canonicalForm() {
        return "countries=" + join(countryIds)
                + ";continents=" + continents.stream().map(Enum::name).collect(Collectors.joining(","))
                + ";type=" + nullable(tripTypeId)
                + ";themes=" + join(themeIds)
                + ";budget=" + nullable(budget)
                + ";duration=" + minDuration + "-" + maxDuration
                + ";difficulty=" + nullable(difficulty)
                + ";year=" + nullable(year)
                + ";month=" + nullable(month);
    }

    private static String join(SortedSet<Long> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static String nullable(Object o) {
        return o == null ? "" : String.valueOf(o);
    }
}
