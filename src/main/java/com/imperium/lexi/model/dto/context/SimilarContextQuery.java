package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 语义检索参数；limit / threshold 为 null 时使用配置默认值（5 / 0.7）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarContextQuery {

    private String userId;
    private String conversationId;
    private Integer limit;
    private Double threshold;
    private List<String> excludeMessageIds;
    private Map<String, String> metadataFilter;

    public EmbeddingFilter toFilter() {
        return EmbeddingFilter.builder()
                .userId(userId)
                .conversationId(conversationId)
                .excludeMessageIds(excludeMessageIds)
                .metadataFilter(metadataFilter)
                .build();
    }
}
