package com.imperium.lexi.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 上下文检索配置：检索参数绑定，以及 embedding 后台/批量写入使用的独立调度器（随应用上下文关闭而 dispose）。
 */
@Configuration
@EnableConfigurationProperties(ContextRetrievalProperties.class)
public class ContextRetrievalConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler embeddingWriteScheduler(ContextRetrievalProperties properties) {
        return Schedulers.newBoundedElastic(
                Math.max(1, properties.getWriteThreads()),
                Math.max(1, properties.getWriteQueueCapacity()),
                "embedding-write");
    }
}
