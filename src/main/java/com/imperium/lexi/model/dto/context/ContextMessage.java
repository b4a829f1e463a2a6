package com.imperium.lexi.model.dto.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 合并后的上下文消息，按时间正序返回给调用方拼 prompt。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextMessage {

    public static final String SOURCE_RECENT = "recent";
    public static final String SOURCE_SEMANTIC = "semantic";

    private String messageId;
    private String role;
    private String content;
    /** 仅语义来源有值 */
    private Double similarity;
    private LocalDateTime timestamp;
    /** recent / semantic */
    private String source;
}
