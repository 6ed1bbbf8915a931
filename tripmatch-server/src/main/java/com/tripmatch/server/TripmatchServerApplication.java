package com.tripmatch.server;

import com.tripmatch.common.properties.CacheProperties;
import com.tripmatch.common.properties.RecommendationProperties;
import com.tripmatch.common.properties.TrainingProperties;
import com.tripmatch.common.properties.WeightProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({RecommendationProperties.class, CacheProperties.class,
        TrainingProperties.class, WeightProperties.class})
@EnableScheduling
public class TripmatchServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripmatchServerApplication.class, args);
    }
}
