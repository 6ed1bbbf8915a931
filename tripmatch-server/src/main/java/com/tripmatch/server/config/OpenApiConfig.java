package com.tripmatch.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置，/v3/api-docs 与 /swagger-ui.html 由 springdoc-openapi-ui 提供。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tripmatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("TripMatch 推荐服务接口文档")
                        .description("行程个性化排序（/user/recommendation）与权重、训练运维（/admin）接口")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}
