package com.tripmatch.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 推荐排序（在线服务路径）配置。
 * Serving path configuration: top-K limits, worker pool and inventory hard filters.
 */
@Data
@ConfigurationProperties(prefix = "tripmatch.recommendation")
public class RecommendationProperties {

    /** 未指定 k 时的默认返回数量 */
    private int defaultK = 10;

    /** 单次请求允许的最大 k，超过直接拒绝 */
    private int maxK = 100;

    /** 候选打分线程池大小 */
    private int workerThreads = 4;

    /**
     * 候选数量达到该阈值才走并行打分，小批量直接在调用线程内完成，避免线程切换开销。
     */
    private int parallelThreshold = 256;

    /** 单次 Top-K 选择的超时时间（毫秒），超时后取消未完成的分片 */
    private long selectionTimeoutMs = 2000L;

    /** 从库存拉取的候选上限 */
    private int maxInventoryCandidates = 2000;

    /** 难度硬过滤容差：目标难度 ±N */
    private int difficultyTolerance = 1;

    /** 预算硬过滤倍数：价格不超过 预算 × N */
    private double budgetMaxMultiplier = 1.3D;

    /** 时长硬过滤：超出区间 N 天以上直接过滤 */
    private int durationHardFilterDays = 7;

    /** 只展示 当前年 + N 年 内出发的行程 */
    private int maxYearsAhead = 1;

    /** 搜索结果不足时是否追加放宽条件的结果 */
    private boolean relaxedEnabled = true;

    /** 主结果数量不超过该值时触发放宽搜索 */
    private int relaxedMinResults = 5;

    /** 放宽后的难度容差 */
    private int relaxedDifficultyTolerance = 2;

    /** 放宽后的预算倍数 */
    private double relaxedBudgetMultiplier = 1.5D;

    /** 放宽后的时长容差（天） */
    private int relaxedDurationDays = 10;

    /** 目标年月前后各放宽 N 个月 */
    private int relaxedDateWindowMonths = 2;

    /** 放宽结果的得分惩罚，加在模型得分上，不参与特征 */
    private double relaxedPenalty = -15.0D;
}
