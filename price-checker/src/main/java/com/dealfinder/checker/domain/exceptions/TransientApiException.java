package com.dealfinder.checker.domain.exceptions;

/** A provider call that may succeed if repeated: timeouts, 5xx, throttling. */
public class TransientApiException extends RuntimeException {

    private TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public static TransientApiException of(String provider, String detail, Throwable cause) {
        return new TransientApiException(provider + " call failed: " + detail, cause);
    }
}
