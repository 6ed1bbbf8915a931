package com.tripmatch.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 推荐缓存配置：归一化偏好缓存（长 TTL）与行程得分缓存（短 TTL）。
 */
@Data
@ConfigurationProperties(prefix = "tripmatch.cache")
public class CacheProperties {

    /** 关闭后所有请求直接计算，不影响正确性 */
    private boolean enabled = true;

    private long preferencesMaxSize = 10_000L;

    private long preferencesTtlHours = 6L;

    private long scoreMaxSize = 200_000L;

    private long scoreTtlMinutes = 20L;
}
