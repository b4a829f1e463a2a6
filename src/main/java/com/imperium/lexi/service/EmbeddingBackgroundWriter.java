package com.imperium.lexi.service;

import com.imperium.lexi.model.dto.context.MessageEmbeddingEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * 消息向量的后台写入：提交后立即返回，写入结果不回传给请求方（最终一致，可能部分失败）。
 */
@Component
public class EmbeddingBackgroundWriter {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingBackgroundWriter.class);

    private final ContextService contextService;
    private final Scheduler writeScheduler;

    public EmbeddingBackgroundWriter(ContextService contextService,
                                     @Qualifier("embeddingWriteScheduler") Scheduler writeScheduler) {
        this.contextService = contextService;
        this.writeScheduler = writeScheduler;
    }

    public Disposable submit(MessageEmbeddingEntry entry) {
        return Mono.fromCallable(() -> contextService.storeMessageEmbedding(entry))
                .subscribeOn(writeScheduler)
                .subscribe(
                        stored -> {
                            if (stored.isEmpty()) {
                                log.debug("Background embedding for message {} not stored", entry.getMessageId());
                            }
                        },
                        e -> log.error("Background embedding write for message {} failed: {}",
                                entry.getMessageId(), e.getMessage(), e));
    }
}
