package com.tripmatch.pojo.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * 一条曝光/点击训练样本，记录后不可变，训练侧只读。
 */
@Value
@Builder
public class TrainingExample {

    String sessionId;

    Long tripId;

    FeatureVector features;

    /** 展示位置，从 0 开始 */
    int position;

    boolean clicked;

    Integer dwellSeconds;

    Boolean converted;

    LocalDateTime timestamp;

    /**
     * 位置偏差修正权重：1 / (1 + position)，越靠前的位置权重越高。
     */
    public double positionWeight() {
        return 1.0D / (1.0D + position);
    }

    public double label() {
        return clicked ? 1.0D : 0.0D;
    }
}
