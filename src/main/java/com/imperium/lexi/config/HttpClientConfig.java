package com.imperium.lexi.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 供 Gemini 等 REST 后端使用的 {@link RestTemplate}。
 * 只设置连接超时；读超时由调用方决定，核心层不做请求级超时。
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${app.http.connect-timeout-ms:5000}") int connectTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(Math.max(1000, connectTimeoutMs)))
                .build();
    }
}
