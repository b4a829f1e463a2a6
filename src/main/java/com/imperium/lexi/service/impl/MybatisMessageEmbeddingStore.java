package com.imperium.lexi.service.impl;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import com.baomidou.mybatisplus.extension.conditions.query.LambdaQueryChainWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.lexi.mapper.MessageEmbeddingMapper;
import com.imperium.lexi.mapper.handler.VectorTypeHandler;
import com.imperium.lexi.model.dto.context.EmbeddingFilter;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.dto.context.VectorSearchQuery;
import com.imperium.lexi.model.entity.MessageEmbedding;
import com.imperium.lexi.service.MessageEmbeddingStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * MyBatis-Plus + PostgreSQL/pgvector 实现（表结构见 db/schema.sql）。
 */
@Service
public class MybatisMessageEmbeddingStore extends ServiceImpl<MessageEmbeddingMapper, MessageEmbedding>
        implements MessageEmbeddingStore {

    @Override
    public MessageEmbedding insert(MessageEmbedding record) {
        baseMapper.insert(record);
        return record;
    }

    @Override
    public List<SimilarMessage> searchNearest(float[] queryVector, EmbeddingFilter filter, int fetchLimit) {
        VectorSearchQuery query = VectorSearchQuery.builder()
                .vector(VectorTypeHandler.toLiteral(queryVector))
                .userId(filter.getUserId())
                .conversationId(filter.getConversationId())
                .excludeMessageIds(filter.getExcludeMessageIds())
                .metadataFilter(filter.getMetadataFilter())
                .fetchLimit(fetchLimit)
                .build();
        return baseMapper.searchNearest(query);
    }

    @Override
    public List<MessageEmbedding> findLatest(EmbeddingFilter filter, int limit) {
        LambdaQueryChainWrapper<MessageEmbedding> query = lambdaQuery()
                .eq(MessageEmbedding::getUserId, filter.getUserId())
                .eq(filter.getConversationId() != null, MessageEmbedding::getConversationId, filter.getConversationId())
                .notIn(filter.getExcludeMessageIds() != null && !filter.getExcludeMessageIds().isEmpty(),
                        MessageEmbedding::getMessageId, filter.getExcludeMessageIds());
        if (filter.getMetadataFilter() != null) {
            for (Map.Entry<String, String> e : filter.getMetadataFilter().entrySet()) {
                query.apply("metadata ->> {0} = {1}", e.getKey(), e.getValue());
            }
        }
        return query
                .orderByDesc(MessageEmbedding::getCreatedAt)
                .orderByDesc(MessageEmbedding::getId)
                .last("LIMIT " + Math.max(1, limit))
                .list();
    }

    @Override
    public int deleteByConversationId(String conversationId) {
        return baseMapper.delete(Wrappers.<MessageEmbedding>lambdaQuery()
                .eq(MessageEmbedding::getConversationId, conversationId));
    }

    @Override
    public boolean deleteByMessageId(String messageId) {
        return lambdaUpdate().eq(MessageEmbedding::getMessageId, messageId).remove();
    }
}
