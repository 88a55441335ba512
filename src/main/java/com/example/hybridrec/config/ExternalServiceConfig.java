package com.example.hybridrec.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 外部协作服务（资源元数据 / 内容相似度 / 图邻居）的 WebClient
 */
@Configuration
public class ExternalServiceConfig {

    @Bean
    public WebClient resourceWebClient(@Value("${external.resource-service.base-url}") String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .build();
    }

    @Bean
    public WebClient similarityWebClient(@Value("${external.similarity-service.base-url}") String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    @Bean
    public WebClient graphWebClient(@Value("${external.graph-service.base-url}") String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .build();
    }
}
