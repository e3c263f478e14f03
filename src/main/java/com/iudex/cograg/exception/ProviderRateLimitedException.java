package com.iudex.cograg.exception;

public class ProviderRateLimitedException extends BackendUnavailableException {

    public ProviderRateLimitedException(String provider, String operation) {
        super(provider, "Rate limit exceeded for provider '" + provider + "' operation '" + operation + "'");
    }
}
