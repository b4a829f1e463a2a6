package com.imperium.lexi.ai.provider;

import com.imperium.lexi.exception.GenerationException;
import com.imperium.lexi.exception.GenerationException.FailureKind;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

/**
 * 把底层客户端异常归类为 {@link FailureKind}。归类只影响日志，不影响降级行为。
 */
public final class ProviderFailures {

    private ProviderFailures() {
    }

    public static GenerationException classify(String provider, String model, Throwable e) {
        if (e instanceof GenerationException ge) {
            return ge;
        }
        String target = model != null ? provider + "/" + model : provider;
        String message = target + " failed: " + e.getMessage();
        return new GenerationException(provider, kindOf(e), message, e);
    }

    public static FailureKind kindOf(Throwable e) {
        if (e instanceof HttpStatusCodeException http) {
            int status = http.getStatusCode().value();
            if (status == 429 || http.getStatusCode().is5xxServerError()) {
                return FailureKind.TRANSIENT;
            }
            if (status == 401 || status == 403) {
                return FailureKind.CONFIGURATION;
            }
            return FailureKind.UNKNOWN;
        }
        if (e instanceof ResourceAccessException || e instanceof TransientAiException) {
            return FailureKind.TRANSIENT;
        }
        if (e instanceof NonTransientAiException) {
            String msg = e.getMessage() != null ? e.getMessage() : "";
            if (msg.contains("401") || msg.contains("403") || msg.contains("invalid_api_key")) {
                return FailureKind.CONFIGURATION;
            }
            if (msg.contains("429") || msg.contains("insufficient_quota")) {
                return FailureKind.TRANSIENT;
            }
        }
        return FailureKind.UNKNOWN;
    }
}
