package com.imperium.lexi.exception;

/**
 * 生成后端调用失败。
 * <p>
 * 网关对所有 {@link FailureKind} 的处理方式一致（切换到下一个后端），区别只体现在日志级别。
 */
public class GenerationException extends RuntimeException {

    public enum FailureKind {
        /** 超时、限流、配额耗尽、5xx */
        TRANSIENT,
        /** 缺少凭证、401/403、后端未配置 */
        CONFIGURATION,
        /** 后端返回了空内容或无法解析的响应 */
        INVALID_RESPONSE,
        UNKNOWN
    }

    private final String provider;
    private final FailureKind kind;

    public GenerationException(String provider, FailureKind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public GenerationException(String provider, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String getProvider() {
        return provider;
    }

    public FailureKind getKind() {
        return kind;
    }
}
