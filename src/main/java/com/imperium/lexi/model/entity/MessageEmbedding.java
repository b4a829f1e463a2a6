package com.imperium.lexi.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.imperium.lexi.mapper.handler.VectorTypeHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 消息向量表实体，对应 message_embeddings 表（每条非 system 消息一行，写入后只读）。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@TableName(value = "message_embeddings", autoResultMap = true)
public class MessageEmbedding {

    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    /** 所属用户 */
    @TableField("user_id")
    private String userId;

    @TableField("conversation_id")
    private String conversationId;

    /** 来源消息ID */
    @TableField("message_id")
    private String messageId;

    /** user / assistant */
    private String role;

    private String content;

    /** 向量，维度与部署配置一致 */
    @TableField(value = "embedding", typeHandler = VectorTypeHandler.class)
    private float[] embedding;

    /** 自由格式元数据：type（默认 chat）、documentType、tone、provider、references、suggestions 等 */
    @TableField(value = "metadata", typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    /** 生成该向量的 embedding 后端 */
    @TableField("embedding_provider")
    private String embeddingProvider;

    @TableField("created_at")
    private LocalDateTime createdAt;
}
