package com.tripmatch.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "tripmatch.weights")
public class WeightProperties {

    /** 历史权重保留期（天），超过保留期的版本不可回滚 */
    private int retentionDays = 90;
}
