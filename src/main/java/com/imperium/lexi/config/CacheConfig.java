package com.imperium.lexi.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheConfig {

    /** 缓存过期与 embedding 时间戳共用的时钟，测试中可替换 */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
