package com.dealfinder.checker.application.controller;

import com.dealfinder.checker.domain.exceptions.RunAlreadyInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(RunAlreadyInProgressException.class)
    public ProblemDetail handleRunInProgress(RunAlreadyInProgressException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
        problem.setTitle("Run In Progress");
        problem.setProperty("code", ErrorCodes.RUN_IN_PROGRESS);
        return problem;
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStoreUnavailable(DataAccessException ex) {
        log.error("State store unavailable", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, "State store unavailable");
        problem.setTitle("Service Unavailable");
        problem.setProperty("code", ErrorCodes.STORE_UNAVAILABLE);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }
}
