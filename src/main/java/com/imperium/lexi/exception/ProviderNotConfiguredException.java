package com.imperium.lexi.exception;

public class ProviderNotConfiguredException extends GenerationException {

    public ProviderNotConfiguredException(String provider) {
        super(provider, FailureKind.CONFIGURATION, provider + " is not configured");
    }
}
