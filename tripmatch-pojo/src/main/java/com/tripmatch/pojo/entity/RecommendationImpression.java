package com.tripmatch.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 推荐曝光日志（由埋点侧写入），训练任务按时间窗口只读。
 */
@Data
@TableName("recommendation_impression")
public class RecommendationImpression {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String sessionId;

    private Long tripId;

    /** 展示位置，从 0 开始 */
    private Integer rankPosition;

    private Boolean clicked;

    private Integer dwellSeconds;

    private Boolean converted;

    /** 埋点侧识别出的爬虫 / 机器人会话 */
    private Boolean botFlag;

    private Integer schemaVersion;

    /** 曝光时的特征向量 JSON */
    private String featuresJson;

    private LocalDateTime createTime;
}
