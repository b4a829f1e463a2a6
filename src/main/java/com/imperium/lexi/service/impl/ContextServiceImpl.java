package com.imperium.lexi.service.impl;

import com.imperium.lexi.cache.CacheKeys;
import com.imperium.lexi.config.ContextRetrievalProperties;
import com.imperium.lexi.model.dto.context.ContextMessage;
import com.imperium.lexi.model.dto.context.EmbeddingFilter;
import com.imperium.lexi.model.dto.context.MessageEmbeddingEntry;
import com.imperium.lexi.model.dto.context.MessageRole;
import com.imperium.lexi.model.dto.context.RelevantContextQuery;
import com.imperium.lexi.model.dto.context.SimilarContextQuery;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.entity.MessageEmbedding;
import com.imperium.lexi.policy.ContextMergePolicy;
import com.imperium.lexi.service.CacheService;
import com.imperium.lexi.service.ContextService;
import com.imperium.lexi.service.EmbeddingService;
import com.imperium.lexi.service.MessageEmbeddingStore;
import com.imperium.lexi.util.TextDigests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ContextServiceImpl implements ContextService {

    private static final Logger log = LoggerFactory.getLogger(ContextServiceImpl.class);

    private static final Comparator<SimilarMessage> BY_SIMILARITY_DESC =
            Comparator.comparingDouble(SimilarMessage::getSimilarity).reversed();

    private static final Comparator<ContextMessage> CHRONOLOGICAL =
            Comparator.comparing(ContextMessage::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final EmbeddingService embeddingService;
    private final MessageEmbeddingStore store;
    private final CacheService cacheService;
    private final Scheduler writeScheduler;
    private final Clock clock;
    private final ContextRetrievalProperties properties;

    public ContextServiceImpl(EmbeddingService embeddingService,
                              MessageEmbeddingStore store,
                              CacheService cacheService,
                              @Qualifier("embeddingWriteScheduler") Scheduler writeScheduler,
                              Clock clock,
                              ContextRetrievalProperties properties) {
        this.embeddingService = embeddingService;
        this.store = store;
        this.cacheService = cacheService;
        this.writeScheduler = writeScheduler;
        this.clock = clock;
        this.properties = properties;
    }

    // ==================== 写入 ====================

    @Override
    public Optional<MessageEmbedding> storeMessageEmbedding(MessageEmbeddingEntry entry) {
        if (entry == null) {
            log.warn("Ignoring null message embedding entry");
            return Optional.empty();
        }
        Optional<MessageRole> role = MessageRole.from(entry.getRole());
        if (role.isEmpty() || role.get() == MessageRole.SYSTEM) {
            log.debug("Skipping embedding for message {} with role {}", entry.getMessageId(), entry.getRole());
            return Optional.empty();
        }
        try {
            Map<String, Object> metadata = new LinkedHashMap<>();
            if (entry.getMetadata() != null) {
                metadata.putAll(entry.getMetadata());
            }
            metadata.putIfAbsent("type", ContextMergePolicy.DEFAULT_METADATA_TYPE);
            Object type = metadata.get("type");
            if (!ContextMergePolicy.METADATA_TYPES.contains(String.valueOf(type))) {
                log.warn("Skipping embedding for message {}: unsupported metadata type '{}'", entry.getMessageId(), type);
                return Optional.empty();
            }

            EmbeddingService.EmbeddingResult embedding =
                    embeddingService.embed(entry.getContent(), entry.getEmbeddingProvider());

            MessageEmbedding record = MessageEmbedding.builder()
                    .userId(entry.getUserId())
                    .conversationId(entry.getConversationId())
                    .messageId(entry.getMessageId())
                    .role(role.get().value())
                    .content(entry.getContent())
                    .embedding(embedding.vector())
                    .metadata(metadata)
                    .embeddingProvider(embedding.provider())
                    .createdAt(LocalDateTime.now(clock))
                    .build();
            MessageEmbedding saved = store.insert(record);
            log.debug("Stored embedding for message {} ({} dims, provider={})",
                    entry.getMessageId(), embedding.vector().length, embedding.provider());
            return Optional.of(saved);
        } catch (RuntimeException e) {
            log.error("Failed to store embedding for message {}: {}", entry.getMessageId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public List<MessageEmbedding> storeMessageEmbeddingsBatch(List<MessageEmbeddingEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return List.of();
        }
        List<MessageEmbedding> stored = Flux.fromIterable(entries)
                .flatMap(entry -> Mono.fromCallable(() -> storeMessageEmbedding(entry))
                        .subscribeOn(writeScheduler)
                        .onErrorResume(e -> {
                            log.error("Batch embedding member {} failed: {}", entry.getMessageId(), e.getMessage());
                            return Mono.just(Optional.<MessageEmbedding>empty());
                        }))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collectList()
                .block();
        int count = stored != null ? stored.size() : 0;
        log.info("Stored {}/{} message embeddings in batch", count, entries.size());
        return stored != null ? stored : List.of();
    }

    // ==================== 检索 ====================

    @Override
    public List<SimilarMessage> findSimilarContext(String queryText, SimilarContextQuery query) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        if (query == null || query.getUserId() == null || query.getUserId().isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        int limit = query.getLimit() != null && query.getLimit() > 0 ? query.getLimit() : properties.getDefaultLimit();
        double threshold = query.getThreshold() != null ? query.getThreshold() : properties.getDefaultThreshold();
        EmbeddingFilter filter = query.toFilter();

        // 所有 embedding 后端都失败时 EmbeddingException 直接抛给调用方
        float[] queryVector = queryEmbedding(queryText);

        if (properties.isNativeSearchEnabled()) {
            try {
                List<SimilarMessage> rows = store.searchNearest(queryVector, filter,
                        limit * Math.max(1, properties.getNativeCandidateFactor()));
                return rank(rows, threshold, limit);
            } catch (RuntimeException e) {
                log.warn("Native vector search failed, falling back to in-process similarity: {}", e.getMessage());
            }
        }
        return bruteForceSearch(queryVector, filter, limit, threshold);
    }

    @Override
    public List<ContextMessage> getRelevantContext(String queryText, RelevantContextQuery query) {
        if (query == null || query.getUserId() == null || query.getUserId().isBlank()) {
            log.warn("getRelevantContext called without user id");
            return List.of();
        }
        int recentLimit = query.getRecentLimit() != null ? query.getRecentLimit() : properties.getRecentLimit();
        int semanticLimit = query.getSemanticLimit() != null ? query.getSemanticLimit() : properties.getSemanticLimit();
        double threshold = query.getThreshold() != null ? query.getThreshold() : properties.getDefaultThreshold();

        List<ContextMessage> recent = List.of();
        if (recentLimit > 0) {
            try {
                EmbeddingFilter filter = EmbeddingFilter.builder()
                        .userId(query.getUserId())
                        .conversationId(query.getConversationId())
                        .build();
                recent = store.findLatest(filter, recentLimit).stream().map(ContextServiceImpl::toRecent).toList();
            } catch (RuntimeException e) {
                log.error("Failed to load recent messages for conversation {}: {}", query.getConversationId(), e.getMessage(), e);
            }
        }

        List<ContextMessage> semantic = List.of();
        if (semanticLimit > 0 && queryText != null && !queryText.isBlank()) {
            try {
                SimilarContextQuery similarQuery = SimilarContextQuery.builder()
                        .userId(query.getUserId())
                        .conversationId(query.getConversationId())
                        .limit(semanticLimit)
                        .threshold(threshold)
                        .build();
                semantic = findSimilarContext(queryText, similarQuery).stream().map(ContextServiceImpl::toSemantic).toList();
            } catch (RuntimeException e) {
                log.error("Failed to load semantic context for conversation {}: {}", query.getConversationId(), e.getMessage(), e);
            }
        }

        return merge(recent, semantic, properties.getDedupPrefixChars());
    }

    // ==================== 删除 ====================

    @Override
    public int deleteConversationEmbeddings(String conversationId) {
        try {
            int deleted = store.deleteByConversationId(conversationId);
            log.info("Deleted {} embeddings for conversation {}", deleted, conversationId);
            return deleted;
        } catch (RuntimeException e) {
            log.error("Failed to delete embeddings for conversation {}", conversationId, e);
            return 0;
        }
    }

    @Override
    public boolean deleteMessageEmbedding(String messageId) {
        try {
            return store.deleteByMessageId(messageId);
        } catch (RuntimeException e) {
            log.error("Failed to delete embedding for message {}", messageId, e);
            return false;
        }
    }

    // ==================== 内部 ====================

    /** 降级路径：取最新的候选记录，进程内计算余弦相似度（O(候选数 × 维度)） */
    private List<SimilarMessage> bruteForceSearch(float[] queryVector, EmbeddingFilter filter, int limit, double threshold) {
        try {
            int candidateLimit = limit * Math.max(1, properties.getFallbackCandidateFactor());
            List<MessageEmbedding> candidates = store.findLatest(filter, candidateLimit);
            List<SimilarMessage> scored = new ArrayList<>(candidates.size());
            for (MessageEmbedding c : candidates) {
                if (c.getEmbedding() == null) {
                    continue;
                }
                scored.add(toSimilar(c, embeddingService.cosineSimilarity(queryVector, c.getEmbedding())));
            }
            return rank(scored, threshold, limit);
        } catch (RuntimeException e) {
            log.error("In-process similarity search failed: {}", e.getMessage(), e);
            return List.of();
        }
    }

    /** 查询向量按默认后端缓存；由备用后端生成的向量不缓存 */
    private float[] queryEmbedding(String queryText) {
        long ttl = properties.getQueryEmbeddingCacheTtl();
        if (ttl <= 0) {
            return embeddingService.generateEmbedding(queryText);
        }
        String defaultProvider = embeddingService.getDefaultProvider();
        String key = CacheKeys.queryEmbedding(defaultProvider, queryText);
        Optional<float[]> cached = cacheService.get(key, float[].class);
        if (cached.isPresent()) {
            log.debug("Query embedding cache hit: {}", TextDigests.preview(queryText, 40));
            return cached.get();
        }
        EmbeddingService.EmbeddingResult result = embeddingService.embed(queryText, defaultProvider);
        if (defaultProvider.equals(result.provider())) {
            cacheService.set(key, result.vector(), ttl);
        } else {
            log.debug("Query embedding served by fallback provider {}, not cached", result.provider());
        }
        return result.vector();
    }

    static List<SimilarMessage> rank(List<SimilarMessage> rows, double threshold, int limit) {
        return rows.stream()
                .filter(r -> r.getSimilarity() >= threshold)
                .sorted(BY_SIMILARITY_DESC)
                .limit(limit)
                .toList();
    }

    /** 按内容前缀去重，语义结果覆盖同内容的最近消息；按时间正序 */
    static List<ContextMessage> merge(List<ContextMessage> recent, List<ContextMessage> semantic, int prefixChars) {
        Map<String, ContextMessage> byKey = new LinkedHashMap<>();
        for (ContextMessage m : recent) {
            byKey.put(ContextMergePolicy.dedupKey(m.getContent(), prefixChars), m);
        }
        for (ContextMessage m : semantic) {
            byKey.put(ContextMergePolicy.dedupKey(m.getContent(), prefixChars), m);
        }
        List<ContextMessage> merged = new ArrayList<>(byKey.values());
        merged.sort(CHRONOLOGICAL);
        return merged;
    }

    private static SimilarMessage toSimilar(MessageEmbedding e, double similarity) {
        return SimilarMessage.builder()
                .messageId(e.getMessageId())
                .conversationId(e.getConversationId())
                .role(e.getRole())
                .content(e.getContent())
                .metadata(e.getMetadata())
                .timestamp(e.getCreatedAt())
                .similarity(similarity)
                .build();
    }

    private static ContextMessage toRecent(MessageEmbedding e) {
        return ContextMessage.builder()
                .messageId(e.getMessageId())
                .role(e.getRole())
                .content(e.getContent())
                .timestamp(e.getCreatedAt())
                .source(ContextMessage.SOURCE_RECENT)
                .build();
    }

    private static ContextMessage toSemantic(SimilarMessage m) {
        return ContextMessage.builder()
                .messageId(m.getMessageId())
                .role(m.getRole())
                .content(m.getContent())
                .similarity(m.getSimilarity())
                .timestamp(m.getTimestamp())
                .source(ContextMessage.SOURCE_SEMANTIC)
                .build();
    }
}
