package com.imperium.lexi.service;

import com.imperium.lexi.model.dto.context.EmbeddingFilter;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.entity.MessageEmbedding;

import java.util.List;

/**
 * 消息向量存储。
 */
public interface MessageEmbeddingStore {

    MessageEmbedding insert(MessageEmbedding record);

    /**
     * 数据库原生近邻查询，按相似度降序，最多 fetchLimit 条（未做阈值过滤）。
     */
    List<SimilarMessage> searchNearest(float[] queryVector, EmbeddingFilter filter, int fetchLimit);

    /**
     * 按过滤条件取最新的记录（created_at 降序），含向量。
     */
    List<MessageEmbedding> findLatest(EmbeddingFilter filter, int limit);

    int deleteByConversationId(String conversationId);

    boolean deleteByMessageId(String messageId);
}
