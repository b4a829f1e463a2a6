package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelevantContextQuery {

    private String userId;
    private String conversationId;
    /** 最近消息条数，默认 3 */
    private Integer recentLimit;
    /** 语义匹配条数，默认 5 */
    private Integer semanticLimit;
    private Double threshold;
}
