package com.pgcluster.ha.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for cluster topology and membership failures.
 * Each subclass carries a stable error code and the HTTP status it maps to.
 */
@Getter
public abstract class ClusterOperationException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ClusterOperationException(String message, String code, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
