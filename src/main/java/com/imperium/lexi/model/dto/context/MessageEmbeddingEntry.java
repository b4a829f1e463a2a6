package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 待写入向量的一条会话消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEmbeddingEntry {

    private String userId;
    private String conversationId;
    private String messageId;
    /** user / assistant；system 消息不写入 */
    private String role;
    private String content;
    private Map<String, Object> metadata;
    /** 首选 embedding 后端，null 时使用默认 */
    private String embeddingProvider;
}
