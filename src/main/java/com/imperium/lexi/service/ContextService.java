package com.imperium.lexi.service;

import com.imperium.lexi.model.dto.context.ContextMessage;
import com.imperium.lexi.model.dto.context.MessageEmbeddingEntry;
import com.imperium.lexi.model.dto.context.RelevantContextQuery;
import com.imperium.lexi.model.dto.context.SimilarContextQuery;
import com.imperium.lexi.model.dto.context.SimilarMessage;
import com.imperium.lexi.model.entity.MessageEmbedding;

import java.util.List;
import java.util.Optional;

/**
 * 会话消息向量的写入与语义上下文检索。
 */
public interface ContextService {

    /**
     * 为一条消息生成并保存向量。system 角色跳过；任何失败只记日志并返回 empty。
     */
    Optional<MessageEmbedding> storeMessageEmbedding(MessageEmbeddingEntry entry);

    /**
     * 语义相似消息，相似度降序。优先数据库原生近邻查询，不可用时降级为进程内余弦相似度。
     *
     * @throws IllegalArgumentException queryText 为空或缺少 userId
     * @throws com.imperium.lexi.exception.EmbeddingException 所有 embedding 后端都无法生成查询向量
     */
    List<SimilarMessage> findSimilarContext(String queryText, SimilarContextQuery query);

    /**
     * 最近消息 + 语义相似消息，按内容前缀去重（保留语义结果），按时间正序返回。不抛异常。
     */
    List<ContextMessage> getRelevantContext(String queryText, RelevantContextQuery query);

    /**
     * 并发写入一批消息并等待全部完成；单条失败不影响其他，只返回成功写入的记录。
     */
    List<MessageEmbedding> storeMessageEmbeddingsBatch(List<MessageEmbeddingEntry> entries);

    /** @return 删除条数，出错时为 0 */
    int deleteConversationEmbeddings(String conversationId);

    /** @return 是否删除，出错时为 false */
    boolean deleteMessageEmbedding(String messageId);
}
