package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 语义检索结果（原生查询与降级路径共用）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarMessage {

    private String messageId;
    private String conversationId;
    private String role;
    private String content;
    private Map<String, Object> metadata;
    private LocalDateTime timestamp;
    /** 余弦相似度 [-1, 1] */
    private double similarity;
}
