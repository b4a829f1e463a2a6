package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * pgvector 近邻查询参数（Mapper 入参）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VectorSearchQuery {

    /** 查询向量的 pgvector 字面量 */
    private String vector;
    private String userId;
    private String conversationId;
    private List<String> excludeMessageIds;
    private Map<String, String> metadataFilter;
    private int fetchLimit;
}
