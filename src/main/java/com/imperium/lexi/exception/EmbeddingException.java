package com.imperium.lexi.exception;

/**
 * 所有 embedding 后端都失败时抛出；每个后端的失败原因以 suppressed 形式附带。
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
