package com.imperium.lexi.util;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

public final class TextDigests {

    private TextDigests() {
    }

    /** 稳定的 md5 hex，用于缓存键 */
    public static String md5Hex(String text) {
        return DigestUtils.md5DigestAsHex((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
    }

    /** 截断到最多 maxChars 个字符（不拒绝超长输入） */
    public static String truncate(String text, int maxChars) {
        if (text == null || maxChars <= 0 || text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars);
    }

    /** 日志预览：单行，最多 limit 个字符 */
    public static String preview(String value, int limit) {
        if (value == null) {
            return "";
        }
        String oneLine = value.replace("\n", "\\n").replace("\r", "");
        return oneLine.length() <= limit ? oneLine : oneLine.substring(0, limit) + "...";
    }
}
