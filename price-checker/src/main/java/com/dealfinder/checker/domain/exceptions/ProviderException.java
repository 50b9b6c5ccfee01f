package com.dealfinder.checker.domain.exceptions;

public class ProviderException extends RuntimeException {

    private ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ProviderException of(String provider, String detail, Throwable cause) {
        return new ProviderException(provider + " rejected request: " + detail, cause);
    }
}
