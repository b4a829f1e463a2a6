package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 向量检索的过滤条件；userId 必填，其余为 null 时不过滤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingFilter {

    private String userId;
    private String conversationId;
    private List<String> excludeMessageIds;
    /** metadata 字段等值过滤，如 type=chat */
    private Map<String, String> metadataFilter;
}
