package com.dealfinder.checker.domain.exceptions;

public class RunAlreadyInProgressException extends RuntimeException {

    private RunAlreadyInProgressException(String message) {
        super(message);
    }

    public static RunAlreadyInProgressException of() {
        return new RunAlreadyInProgressException("A price check run is already in progress");
    }
}
